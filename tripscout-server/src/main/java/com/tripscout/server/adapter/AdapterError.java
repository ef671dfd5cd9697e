package com.tripscout.server.adapter;

/**
 * 数据源调用失败的描述。
 */
public class AdapterError {

    private final String category;

    /** exception / timeout / http_xxx / not_configured / bad_response */
    private final String type;

    private final String message;

    public AdapterError(String category, String type, String message) {
        this.category = category;
        this.type = type;
        this.message = message;
    }

    public String getCategory() {
        return category;
    }

    public String getType() {
        return type;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return category + "/" + type + ": " + message;
    }
}
