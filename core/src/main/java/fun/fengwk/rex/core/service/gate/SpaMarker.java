package fun.fengwk.rex.core.service.gate;

/**
 * Single-page-application markers packed into {@link GateFeatures#getSpaMarkerFlags()}.
 *
 * @author fengwk
 */
public enum SpaMarker {

    /**
     * Framework hydration payloads such as {@code __NEXT_DATA__} or {@code data-reactroot}.
     */
    HYDRATION(0x01),

    /**
     * Empty framework root container such as {@code <div id="root">}.
     */
    FRAMEWORK_ROOT(0x02),

    /**
     * Script payload dominates the page.
     */
    OVERSIZED_BUNDLE(0x04),

    /**
     * Content is only reachable with javascript enabled.
     */
    SPA_ONLY_CONTENT(0x08);

    private final int bit;

    SpaMarker(int bit) {
        this.bit = bit;
    }

    public int getBit() {
        return bit;
    }

    public boolean isSet(int flags) {
        return (flags & bit) != 0;
    }

    public static int flagsOf(SpaMarker... markers) {
        int flags = 0;
        for (SpaMarker marker : markers) {
            flags |= marker.bit;
        }
        return flags;
    }

    public static int countSetBits(int flags) {
        return Integer.bitCount(flags & 0xFF);
    }

}
