package com.terralint.core.util;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;

/**
 * File system helpers shared by source discovery and the file naming rules.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Reads a file as UTF-8, falling back to ISO-8859-1 for files that are not valid UTF-8.
     *
     * @param path file to read
     * @return file content
     * @throws IOException if the file cannot be read
     */
    public static String readString(Path path) throws IOException {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            return Files.readString(path, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Returns the file extension without the dot.
     *
     * @param path file path
     * @return extension, or empty string
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Returns the file name up to its first dot: {@code prod.auto.tfvars} gives {@code prod}.
     *
     * @param path file path
     * @return stem of the file name
     */
    public static String getStem(Path path) {
        String fileName = path.getFileName().toString();
        int firstDot = fileName.indexOf('.');
        return firstDot > 0 ? fileName.substring(0, firstDot) : fileName;
    }

    /**
     * Returns true for Terraform configuration files ({@code .tf}).
     *
     * @param path file path
     * @return true if the extension is {@code tf}
     */
    public static boolean isConfigurationFile(Path path) {
        return "tf".equals(getExtension(path));
    }

    /**
     * Returns true for variable value files ({@code .tfvars}).
     *
     * @param path file path
     * @return true if the extension is {@code tfvars}
     */
    public static boolean isVariableValuesFile(Path path) {
        return "tfvars".equals(getExtension(path));
    }

    public static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }

    /**
     * Creates a glob matcher for paths relative to a lint root.
     *
     * @param globPattern glob such as {@code modules/**}
     * @return path matcher
     */
    public static PathMatcher globMatcher(String globPattern) {
        return FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
    }
}
