package appraiser.adapter.in.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

import com.fasterxml.jackson.annotation.JsonProperty;

import appraiser.core.model.InvalidRequestException;
import appraiser.core.model.prediction.HouseFeatures;
import appraiser.core.model.prediction.OceanProximity;

/**
 * Features of one census block as sent by clients.
 */
public record HouseFeaturesDto(
        @NotNull @DecimalMin("-180") @DecimalMax("180") Double longitude,
        @NotNull @DecimalMin("-90") @DecimalMax("90") Double latitude,
        @JsonProperty("housing_median_age") @NotNull @DecimalMin("0") @DecimalMax("100") Double housingMedianAge,
        @JsonProperty("total_rooms") @NotNull @DecimalMin("0") Double totalRooms,
        @JsonProperty("total_bedrooms") @NotNull @DecimalMin("0") Double totalBedrooms,
        @NotNull @DecimalMin("0") Double population,
        @NotNull @DecimalMin("0") Double households,
        @JsonProperty("median_income") @NotNull @DecimalMin("0") Double medianIncome,
        @JsonProperty("ocean_proximity")
                @NotNull
                @Pattern(
                        regexp = "<1H OCEAN|INLAND|ISLAND|NEAR BAY|NEAR OCEAN",
                        message = "must be one of <1H OCEAN, INLAND, ISLAND, NEAR BAY, NEAR OCEAN")
                String oceanProximity) {

    public HouseFeatures toModel() {
        return new HouseFeatures(
                longitude,
                latitude,
                housingMedianAge,
                totalRooms,
                totalBedrooms,
                population,
                households,
                medianIncome,
                OceanProximity.fromLabel(oceanProximity)
                        .orElseThrow(() -> new InvalidRequestException("Unknown ocean_proximity: " + oceanProximity)));
    }
}
