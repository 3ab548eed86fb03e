package appraiser.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.model.prediction.BatchPrediction;
import appraiser.core.model.prediction.HouseFeatures;
import appraiser.core.model.prediction.Prediction;

/**
 * Port interface for house price estimates. Every estimate is audited.
 */
public interface HousePricing {

    Uni<Prediction> predict(HouseFeatures features, AuthenticatedCaller caller);

    Uni<BatchPrediction> predictBatch(List<HouseFeatures> houses, AuthenticatedCaller caller);
}
