package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version - 语义化版本号
 * <p>
 * 格式: major.minor.patch (如 1.0.0)，各段为非负整数。
 * </p>
 *
 * @author funcmodel
 */
@EqualsAndHashCode
public final class Version implements Comparable<Version> {

    private static final Pattern SEMVER = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private final int major;
    private final int minor;
    private final int patch;

    private Version(int major, int minor, int patch) {
        this.major = major;
        this.minor = minor;
        this.patch = patch;
    }

    public static Result<Version> create(String value) {
        if (value == null || value.isBlank()) {
            return Result.fail("Version cannot be empty");
        }
        Matcher matcher = SEMVER.matcher(value.trim());
        if (!matcher.matches()) {
            return Result.fail("Invalid semantic version format: " + value + ". Expected: major.minor.patch");
        }
        try {
            return Result.ok(new Version(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3))));
        } catch (NumberFormatException e) {
            return Result.fail("Version segment out of range: " + value);
        }
    }

    public static Version initial() {
        return new Version(1, 0, 0);
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public Version incrementMajor() {
        return new Version(major + 1, 0, 0);
    }

    public Version incrementMinor() {
        return new Version(major, minor + 1, 0);
    }

    public Version incrementPatch() {
        return new Version(major, minor, patch + 1);
    }

    public boolean isGreaterThan(Version other) {
        return compareTo(other) > 0;
    }

    public boolean isLessThan(Version other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(Version other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
