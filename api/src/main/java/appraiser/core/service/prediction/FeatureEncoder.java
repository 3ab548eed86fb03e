package appraiser.core.service.prediction;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import appraiser.core.model.prediction.HouseFeatures;
import appraiser.core.model.prediction.OceanProximity;

/**
 * Encodes house features into the column layout the model was trained on.
 *
 * <p>Columns: the eight numeric features in declaration order, followed by one
 * one-hot column per {@link OceanProximity} in enum order.
 */
public final class FeatureEncoder {

    public static final List<String> NUMERIC_COLUMNS = List.of(
            "longitude",
            "latitude",
            "housing_median_age",
            "total_rooms",
            "total_bedrooms",
            "population",
            "households",
            "median_income");

    public static final int COLUMN_COUNT = NUMERIC_COLUMNS.size() + OceanProximity.values().length;

    private FeatureEncoder() {}

    public static double[] encode(HouseFeatures features) {
        double[] row = new double[COLUMN_COUNT];
        row[0] = features.longitude();
        row[1] = features.latitude();
        row[2] = features.housingMedianAge();
        row[3] = features.totalRooms();
        row[4] = features.totalBedrooms();
        row[5] = features.population();
        row[6] = features.households();
        row[7] = features.medianIncome();
        row[NUMERIC_COLUMNS.size() + features.oceanProximity().ordinal()] = 1.0;
        return row;
    }

    public static double[][] encodeAll(List<HouseFeatures> houses) {
        double[][] rows = new double[houses.size()][];
        for (int i = 0; i < houses.size(); i++) {
            rows[i] = encode(houses.get(i));
        }
        return rows;
    }

    /**
     * Snapshot of the request features for the audit trail, keyed by wire name.
     */
    public static Map<String, Object> snapshot(HouseFeatures features) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("longitude", features.longitude());
        out.put("latitude", features.latitude());
        out.put("housing_median_age", features.housingMedianAge());
        out.put("total_rooms", features.totalRooms());
        out.put("total_bedrooms", features.totalBedrooms());
        out.put("population", features.population());
        out.put("households", features.households());
        out.put("median_income", features.medianIncome());
        out.put("ocean_proximity", features.oceanProximity().label());
        return out;
    }
}
