package com.example.fileaudit.archive;

public record ColdObjectRef(String bucket, String key) {
    private static final String SCHEME = "s3://";

    public static ColdObjectRef parse(String uri) {
        if (uri == null || !uri.startsWith(SCHEME)) {
            throw new IllegalArgumentException("Invalid archive reference: " + uri);
        }
        String remainder = uri.substring(SCHEME.length());
        int slash = remainder.indexOf('/');
        if (slash <= 0 || slash == remainder.length() - 1) {
            throw new IllegalArgumentException("Invalid archive reference: " + uri);
        }
        return new ColdObjectRef(remainder.substring(0, slash), remainder.substring(slash + 1));
    }

    public String uri() {
        return SCHEME + bucket + "/" + key;
    }

    @Override
    public String toString() {
        return uri();
    }
}
