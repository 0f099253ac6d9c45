package com.hvacintel.consumption.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "consumption-estimator")
@Data
public class EstimatorProperties {

    private Roster roster = new Roster();
    private Telemetry telemetry = new Telemetry();
    private Availability availability = new Availability();
    private Calibration calibration = new Calibration();
    private Attribution attribution = new Attribution();
    private Workers workers = new Workers();
    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();

    /**
     * Client unit roster CSV. The automation start date column uses {@link #datePattern}.
     */
    @Data
    public static class Roster {
        private String path = "/data/input/units.csv";
        private String unitIdColumn = "id_bradesco";
        private String unitNameColumn = "unit_name";
        private String automationStartColumn = "data_inicio_automacao";
        private String installOffsetColumn = "dias_antes_automacao";
        private String datePattern = "M/d/yy";
    }

    @Data
    public static class Telemetry {
        /** Table holding one version's device-day payloads; %s is replaced by the version. */
        private String tableTemplate = "cache_dev_gen.\"%s\"";
        private String deviceColumn = "dev_id";
        private String dateColumn = "day";
        private String payloadExpression = "charts_detailed ->> 'Curr'";
        /** Only devices whose id starts with this prefix are read from telemetry. Blank disables the filter. */
        private String deviceIdPrefix = "DAC";
        private String ignoreMarker = "*";
        /** Number of leading device id characters that name the device version (and its table). */
        private int versionLength = 8;
    }

    @Data
    public static class Availability {
        /** Minimum daily availability percentage for a device-date to count. */
        private int threshold = 75;
    }

    @Data
    public static class Calibration {
        private double defaultFactor = 310.94;
        /** Factor per device family prefix; the longest matching prefix wins. */
        private Map<String, Double> factors = new LinkedHashMap<>();
    }

    @Data
    public static class Attribution {
        private ConsolidationPolicy consolidationPolicy = ConsolidationPolicy.PREFER_DIRECT;

        public enum ConsolidationPolicy {
            PREFER_DIRECT, KEEP_BOTH
        }
    }

    @Data
    public static class Workers {
        private int poolSize = 4;
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CSV;
        private Csv csv = new Csv();
        private ClickHouse clickhouse = new ClickHouse();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        @Data
        public static class ClickHouse {
            private String database = "hvac_intel";
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
    }
}
