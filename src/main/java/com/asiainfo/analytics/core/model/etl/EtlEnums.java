package com.asiainfo.analytics.core.model.etl;

import java.util.Locale;

final class EtlEnums {

    private EtlEnums() {
    }

    /**
     * 小写编码（如 etl_process）转枚举，无法识别返回 null
     */
    static <E extends Enum<E>> E parse(Class<E> type, String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        try {
            return Enum.valueOf(type, code.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
