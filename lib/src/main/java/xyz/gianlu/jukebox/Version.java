/*
 * Copyright 2022 devgianlu
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package xyz.gianlu.jukebox;

import org.jetbrains.annotations.NotNull;

/**
 * @author Gianlu
 */
public final class Version {
    private static final String VERSION;

    static {
        Package pkg = Version.class.getPackage();
        String version = pkg == null ? null : pkg.getImplementationVersion();
        if (version == null && pkg != null) version = pkg.getSpecificationVersion();
        VERSION = version == null ? "?.?.?" : version;
    }

    private Version() {
    }

    @NotNull
    public static String versionNumber() {
        return VERSION;
    }

    @NotNull
    public static String versionString() {
        return "jukebox-java " + VERSION;
    }

    @NotNull
    public static String systemInfoString() {
        return versionString() + "; Java " + System.getProperty("java.version") + "; " + System.getProperty("os.name");
    }
}
