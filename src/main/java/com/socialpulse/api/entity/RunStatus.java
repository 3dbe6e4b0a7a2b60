package com.socialpulse.api.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {

    SUCCESS,
    PARTIAL,
    FAILED;

    /**
     * failed: 결과 0건 + 에러 1건 이상
     * partial: 에러가 있었지만 일부 결과는 있음
     * success: 에러 없음
     */
    public static RunStatus derive(int itemCount, int errorCount) {
        if (errorCount > 0 && itemCount == 0) {
            return FAILED;
        }
        if (errorCount > 0) {
            return PARTIAL;
        }
        return SUCCESS;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase();
    }
}
