package io.dynamis.assets.api;

/**
 * Host-side startup gate. The host declares itself ready only once every hold is cleared.
 *
 * The asset manager owns the "assets" hold and clears it exactly once, the first time
 * local plus remote remaining work reaches zero before boot has completed.
 */
public interface BootGate {

    /** True once the host has finished its boot sequence. */
    boolean isBootComplete();

    /**
     * Releases one named hold.
     *
     * @param holdName see AssetConstants.BOOT_HOLD_ASSETS
     */
    void clearBootHold(String holdName);

    /** Gate for hosts without a boot sequence. Reports boot as complete; clears nothing. */
    BootGate NONE = new BootGate() {
        @Override
        public boolean isBootComplete() { return true; }

        @Override
        public void clearBootHold(String holdName) {}
    };
}
