package me.golemcore.interactions.domain.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Ordering of {@code major.minor.patch[-prerelease]} version strings. Missing
 * or non-numeric components count as zero; a pre-release sorts before its
 * release.
 */
public record SemanticVersion(int major, int minor, int patch, String preRelease)
        implements Comparable<SemanticVersion> {

    public static SemanticVersion parse(String version) {
        if (version == null || version.isBlank()) {
            return new SemanticVersion(0, 0, 0, null);
        }
        String value = version.trim();
        if (value.startsWith("v") || value.startsWith("V")) {
            value = value.substring(1);
        }
        int build = value.indexOf('+');
        if (build >= 0) {
            value = value.substring(0, build);
        }
        String preRelease = null;
        int dash = value.indexOf('-');
        if (dash >= 0) {
            preRelease = value.substring(dash + 1);
            value = value.substring(0, dash);
        }
        String[] parts = value.split("\\.");
        return new SemanticVersion(component(parts, 0), component(parts, 1), component(parts, 2), preRelease);
    }

    public static int compare(String left, String right) {
        return parse(left).compareTo(parse(right));
    }

    @Override
    public int compareTo(SemanticVersion other) {
        int result = Integer.compare(major, other.major);
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        if (result == 0) {
            result = Integer.compare(patch, other.patch);
        }
        if (result != 0) {
            return result;
        }
        if (preRelease == null) {
            return other.preRelease == null ? 0 : 1;
        }
        if (other.preRelease == null) {
            return -1;
        }
        return preRelease.compareTo(other.preRelease);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch + (preRelease != null ? "-" + preRelease : "");
    }

    private static int component(String[] parts, int index) {
        if (index >= parts.length) {
            return 0;
        }
        try {
            return Integer.parseInt(parts[index].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
