package com.example.threadlog.logs.models;

/**
 * Where a log call was made from.
 */
public record CallSite(String function, String file, int line) {

    public static final CallSite NONE = new CallSite("", "", 0);
    public static final CallSite UNAVAILABLE = new CallSite("Unknown", "Unable to obtain call site.", 0);

    public static CallSite of(String className, String methodName, String file, int line) {
        return new CallSite(shortFunctionName(className, methodName), file == null ? "" : file, Math.max(line, 0));
    }

    /**
     * Drops the package, and the {@code /suffix} of hidden class names, so
     * {@code com.example.Foo.bar} becomes {@code Foo.bar}.
     */
    static String shortFunctionName(String className, String methodName) {
        String name = className;
        int slash = name.lastIndexOf('/');
        if (slash != -1) {
            name = name.substring(0, slash);
        }
        int dot = name.lastIndexOf('.');
        if (dot != -1) {
            name = name.substring(dot + 1);
        }
        return name + "." + methodName;
    }
}
