package appraiser.core.model.prediction;

/**
 * Features describing one census block, as accepted by the regression model.
 *
 * <p>Range checks happen at the HTTP boundary; this record only rejects a missing
 * proximity.
 */
public record HouseFeatures(
        double longitude,
        double latitude,
        double housingMedianAge,
        double totalRooms,
        double totalBedrooms,
        double population,
        double households,
        double medianIncome,
        OceanProximity oceanProximity) {

    public HouseFeatures {
        if (oceanProximity == null) {
            throw new IllegalArgumentException("oceanProximity cannot be null");
        }
    }
}
