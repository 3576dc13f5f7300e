package com.timxs.imageoptimizer.model;

import java.util.List;

/**
 * 附件元数据键
 */
public final class MetadataKeys {

    /**
     * 终态标记，存在且为 true 表示已处理
     */
    public static final String OPTIMIZED = "optimized";

    public static final String STATUS = "opt_status";

    public static final String ERROR = "opt_error";

    /**
     * 完整的 {@link ConversionResult}
     */
    public static final String DATA = "opt_data";

    /**
     * 原图已删除的永久标记
     */
    public static final String ORIGINALS_DELETED = "originals_deleted";

    /**
     * 恢复原图时需要清除的全部键
     */
    public static final List<String> OPTIMIZATION_KEYS = List.of(OPTIMIZED, STATUS, ERROR, DATA, ORIGINALS_DELETED);

    private MetadataKeys() {
    }
}
