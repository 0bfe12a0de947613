package natvis;

public class NatvisConfig {
    public static enum DisplayStringsMode {
        ON,
        OFF,
        /**
         * only compute display strings for values that are already part of a visualized expansion
         */
        FOR_VISUALIZED_ITEMS
    }

    public static final int MAX_EXPAND = 50;
    public static final int MAX_FORMAT_DEPTH = 10;
    public static final int MAX_ALIAS_CHAIN = 10;
    public static final int MAX_EXPAND_DEPTH = 10;

    private volatile DisplayStringsMode showDisplayStrings_;

    /**
     * @param showDisplayStrings if false, display strings are computed only for visualized items
     */
    public NatvisConfig(boolean showDisplayStrings) {
        this.showDisplayStrings_ = showDisplayStrings ? DisplayStringsMode.ON : DisplayStringsMode.FOR_VISUALIZED_ITEMS;
    }

    public DisplayStringsMode getShowDisplayStrings() {
        return showDisplayStrings_;
    }
    public void setShowDisplayStrings(DisplayStringsMode v) {
        this.showDisplayStrings_ = v;
    }
}
