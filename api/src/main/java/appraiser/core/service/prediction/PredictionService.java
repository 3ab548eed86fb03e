package appraiser.core.service.prediction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import appraiser.core.model.InvalidRequestException;
import appraiser.core.model.audit.PredictionLog;
import appraiser.core.model.audit.RequestType;
import appraiser.core.model.auth.AuthenticatedCaller;
import appraiser.core.model.prediction.BatchPrediction;
import appraiser.core.model.prediction.HouseFeatures;
import appraiser.core.model.prediction.Prediction;
import appraiser.core.model.prediction.PredictionException;
import appraiser.core.port.in.HousePricing;
import appraiser.core.port.out.PredictionLogRepository;
import appraiser.core.port.out.RegressionModel;
import appraiser.core.port.out.ServiceMetrics;

/**
 * Produces house price estimates and records each one in the audit trail.
 */
@ApplicationScoped
public class PredictionService implements HousePricing {

    private static final Logger LOG = Logger.getLogger(PredictionService.class);

    public static final int MAX_BATCH_SIZE = 100;
    private static final int PRICE_SCALE = 8;

    private final RegressionModel model;
    private final PredictionLogRepository logs;
    private final ServiceMetrics metrics;

    @Inject
    public PredictionService(RegressionModel model, PredictionLogRepository logs, ServiceMetrics metrics) {
        this.model = model;
        this.logs = logs;
        this.metrics = metrics;
    }

    @Override
    public Uni<Prediction> predict(HouseFeatures features, AuthenticatedCaller caller) {
        long start = System.nanoTime();
        double price;
        try {
            price = round(model.predict(FeatureEncoder.encode(features)));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Prediction failed for key %d", caller.id());
            return Uni.createFrom().failure(new PredictionException("Prediction failed", e));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.recordPrediction(RequestType.SINGLE, 1, elapsedMs);

        PredictionLog entry = new PredictionLog(
                0,
                caller.id(),
                FeatureEncoder.snapshot(features),
                price,
                elapsedMs,
                RequestType.SINGLE,
                null,
                Instant.now());
        return logs.save(entry).map(saved -> {
            LOG.infof("Prediction for %s: %.2f USD", caller.name(), price);
            return Prediction.usd(price);
        });
    }

    @Override
    public Uni<BatchPrediction> predictBatch(List<HouseFeatures> houses, AuthenticatedCaller caller) {
        if (houses == null || houses.isEmpty() || houses.size() > MAX_BATCH_SIZE) {
            return Uni.createFrom()
                    .failure(new InvalidRequestException(
                            "Batch must contain between 1 and " + MAX_BATCH_SIZE + " houses"));
        }

        long start = System.nanoTime();
        double[] prices;
        try {
            prices = model.predictAll(FeatureEncoder.encodeAll(houses));
            for (int i = 0; i < prices.length; i++) {
                prices[i] = round(prices[i]);
            }
        } catch (RuntimeException e) {
            LOG.errorf(e, "Batch prediction failed for key %d", caller.id());
            return Uni.createFrom().failure(new PredictionException("Batch prediction failed", e));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.recordPrediction(RequestType.BATCH, houses.size(), elapsedMs);

        String batchId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        List<Prediction> predictions = new ArrayList<>(prices.length);
        List<PredictionLog> entries = new ArrayList<>(prices.length);
        for (int i = 0; i < prices.length; i++) {
            double price = prices[i];
            predictions.add(Prediction.usd(price));
            entries.add(new PredictionLog(
                    0,
                    caller.id(),
                    FeatureEncoder.snapshot(houses.get(i)),
                    price,
                    elapsedMs,
                    RequestType.BATCH,
                    batchId,
                    now));
        }

        return logs.saveAll(entries).map(saved -> {
            LOG.infof("Batch %s complete: %d predictions for %s", batchId, predictions.size(), caller.name());
            return new BatchPrediction(predictions, batchId);
        });
    }

    static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new PredictionException("Model produced a non-finite estimate");
        }
        return BigDecimal.valueOf(value).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
