package io.dynamis.assets.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when an asset file cannot be found on any search path.
 *
 * Carries the searched locations for diagnostics.
 */
public final class AssetNotFoundException extends Exception {

    private final String fileName;
    private final List<Path> searchedPaths;

    public AssetNotFoundException(String fileName, List<Path> searchedPaths) {
        super("Could not locate asset file '" + fileName + "' in " + searchedPaths);
        this.fileName = fileName;
        this.searchedPaths = List.copyOf(searchedPaths);
    }

    /** File name that was looked up. */
    public String fileName() { return fileName; }

    /** Candidate paths checked, in search order. */
    public List<Path> searchedPaths() { return searchedPaths; }
}
