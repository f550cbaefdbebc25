package com.xingest.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;
import java.time.temporal.TemporalAccessor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LoggingConfigurator 로 핸들러를 잡은 뒤 호출하면 한 이벤트가 한 줄 JSON 으로 찍힌다.
 * 예) {"ts":"...","lvl":"INFO","comp":"ScrapeService","event":"cache-hit","identity":"nasa","ageSec":12.5}
 */
public final class StructuredLog {
    private static final ObjectMapper OM = ScrapeJson.mapper();

    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs)  { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs)  { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** 패키지 내부 테스트용으로 노출 */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode node = OM.createObjectNode();
        node.put("ts", Instant.now().toString());
        node.put("lvl", lvl.getName());
        node.put("comp", comp);
        node.put("thread", Thread.currentThread().getName());
        node.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                node.set(String.valueOf(kvs[i]), value(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) node.put("_kv_mismatch", true);
        }
        if (t != null) {
            node.put("error", t.getClass().getSimpleName());
            node.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // 트리 노드라 사실상 도달하지 않음. Jackson 기본 toString 으로 대체
            return node.toString();
        }
    }

    /** 숫자/불리언/시간은 타입 그대로, 나머지는 toString() */
    private static JsonNode value(Object v) {
        if (v == null) return NullNode.getInstance();
        if (v instanceof Number || v instanceof Boolean || v instanceof TemporalAccessor) {
            return OM.valueToTree(v);
        }
        return TextNode.valueOf(String.valueOf(v));
    }
}
