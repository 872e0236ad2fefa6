package ai.attackframework.tools.logwindow.utils.config;

/** JSON keys of the log window configuration. */
public final class ConfigKeys {
    private ConfigKeys() { }

    public static final String MAX_ITEMS         = "maxItems";
    public static final String MIN_LEVEL         = "minLevel";
    public static final String AUTO_SCROLL       = "autoScroll";
    public static final String TIMESTAMP_PATTERN = "timestampPattern";
    public static final String TITLE             = "title";
}
