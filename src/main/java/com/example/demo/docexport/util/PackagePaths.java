package com.example.demo.docexport.util;

/**
 * Relative image paths as written into a LaTeX source and used as zip entry
 * names, so both sides of a package agree.
 */
public final class PackagePaths {

    private PackagePaths() {
    }

    /**
     * Forward slashes, no leading slash or "./". Empty when the path climbs
     * out of the package with a ".." segment.
     */
    public static String relativeName(String path) {
        if (path == null) {
            return "";
        }
        String name = path.replace('\\', '/');
        while (name.startsWith("/") || name.startsWith("./")) {
            name = name.startsWith("/") ? name.substring(1) : name.substring(2);
        }
        if (name.equals("..") || name.startsWith("../") || name.contains("/../") || name.endsWith("/..")) {
            return "";
        }
        return name;
    }
}
