package com.planwright.core.engine;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Mints project ids: {@code proj_} followed by the first 10 hex characters of
 * MD5({@code <projectName>_<epochMillis>}).
 * <p>
 * Ids name checkpoint directories, so a usable id is a single path segment of
 * letters, digits, {@code .}, {@code _} or {@code -}.
 */
public final class ProjectIds {

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9._-]+");

    private ProjectIds() {}

    public static boolean isValid(String projectId) {
        return projectId != null && VALID.matcher(projectId).matches()
                && !projectId.equals(".") && !projectId.equals("..");
    }

    public static String generate(String projectName, long epochMillis) {
        String seed = (projectName == null ? "unnamed" : projectName) + "_" + epochMillis;
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(seed.getBytes(StandardCharsets.UTF_8));
            return "proj_" + HexFormat.of().formatHex(digest).substring(0, 10);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
