package com.dealbot.common.constants;

public final class ProbeDefaults {

    private ProbeDefaults() {}

    public static final String DEFAULT_UPLOAD_NAME = "dealbot-upload";
    public static final String SCRATCH_PREFIX = "dealbot-car-";

    // UnixFS importer defaults
    public static final int CHUNK_SIZE_BYTES = 256 * 1024;
    public static final int MAX_LINKS_PER_NODE = 174;
    public static final int MAX_BLOCK_SIZE_BYTES = 5 * 1024 * 1024;

    public static final String USER_AGENT =
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0 Safari/537.36";

    public static final String RAW_BLOCK_CONTENT_TYPE = "application/vnd.ipld.raw";
    public static final String CAR_CONTENT_TYPE = "application/vnd.ipld.car";

    /** Schedule rows for global jobs use an empty provider address. */
    public static final String GLOBAL_SP_ADDRESS = "";
}
