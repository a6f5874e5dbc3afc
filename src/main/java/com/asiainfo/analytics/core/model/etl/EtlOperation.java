package com.asiainfo.analytics.core.model.etl;

import java.util.Locale;

/**
 * process-etl 接口允许的操作、源类型、处理模式
 */
public enum EtlOperation {
    ETL_PROCESS,
    DATA_QUALITY_CHECK,
    CUBE_REBUILD,
    LINEAGE_ANALYSIS;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EtlOperation fromCode(String code) {
        return EtlEnums.parse(EtlOperation.class, code);
    }

    public enum SourceType {
        TRANSACTIONAL, OPERATIONAL, EXTERNAL, STREAMING;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static SourceType fromCode(String code) {
            return EtlEnums.parse(SourceType.class, code);
        }
    }

    public enum ProcessingMode {
        BATCH, STREAMING, HYBRID;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static ProcessingMode fromCode(String code) {
            return EtlEnums.parse(ProcessingMode.class, code);
        }
    }
}
