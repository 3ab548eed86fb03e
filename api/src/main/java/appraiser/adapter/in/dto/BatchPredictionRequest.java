package appraiser.adapter.in.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BatchPredictionRequest(
        @NotNull @Size(min = 1, max = 100) List<@NotNull @Valid HouseFeaturesDto> houses) {}
