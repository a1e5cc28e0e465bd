package com.brandflow.workflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum Region {
    SEOUL, BUSAN, DAEGU, INCHEON, GWANGJU, DAEJEON, ULSAN, GYEONGGI, GANGWON, CHUNGBUK, CHUNGNAM, JEONBUK, JEONNAM, GYEONGBUK, GYEONGNAM, JEJU;

    @JsonValue
    public String key() {
        return LowercaseEnums.key(this);
    }

    public static Optional<Region> parse(String raw) {
        return LowercaseEnums.parse(Region.class, raw);
    }

    @JsonCreator
    static Region fromJson(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown region: " + raw));
    }
}
