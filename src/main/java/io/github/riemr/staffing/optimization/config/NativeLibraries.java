package io.github.riemr.staffing.optimization.config;

import com.google.ortools.Loader;

import lombok.extern.slf4j.Slf4j;

/** OR-Tools のネイティブライブラリをプロセス内で 1 度だけロードする。 */
@Slf4j
public final class NativeLibraries {

    private static boolean loaded = false;

    private NativeLibraries() {}

    public static synchronized void ensureLoaded() {
        if (!loaded) {
            Loader.loadNativeLibraries();
            loaded = true;
            log.info("OR-Tools native libraries loaded");
        }
    }
}
