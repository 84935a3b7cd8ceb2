package com.sparrowlogic.networktopology.service;

import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.SdkField;
import software.amazon.awssdk.core.SdkPojo;
import software.amazon.awssdk.core.util.SdkAutoConstructList;
import software.amazon.awssdk.core.util.SdkAutoConstructMap;

import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an SDK response into plain maps and lists keyed by the API's own member names, so Jackson
 * can write it out as the service returned it. Members the service left unset are dropped.
 */
final class SdkResponseJson {

    private SdkResponseJson() {
    }

    static Object toTree(Object value) {
        if (value instanceof SdkPojo pojo) {
            var node = new LinkedHashMap<String, Object>();
            for (SdkField<?> field : pojo.sdkFields()) {
                var member = field.getValueOrDefault(pojo);
                if (member == null || member instanceof SdkAutoConstructList<?> || member instanceof SdkAutoConstructMap<?, ?>) {
                    continue;
                }
                node.put(field.memberName(), toTree(member));
            }
            return node;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(SdkResponseJson::toTree).toList();
        }
        if (value instanceof Map<?, ?> map) {
            var node = new LinkedHashMap<String, Object>();
            map.forEach((key, member) -> node.put(String.valueOf(key), toTree(member)));
            return node;
        }
        if (value instanceof Instant instant) {
            return instant.toString();
        }
        if (value instanceof SdkBytes bytes) {
            return Base64.getEncoder().encodeToString(bytes.asByteArray());
        }
        return value;
    }
}
