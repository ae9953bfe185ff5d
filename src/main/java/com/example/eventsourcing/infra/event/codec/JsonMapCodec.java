package com.example.eventsourcing.infra.event.codec;

import java.util.Map;

import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * payload / metadata 的 JSON 編解碼器
 *
 * <p>
 * 在 {@code Map<String, Object>} 與 JSON 字串之間轉換。序列化失敗視為系統錯誤，反序列化失敗視為資料損毀，
 * 由呼叫端轉換為對應的領域例外。
 * </p>
 */
public class JsonMapCodec {

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
	};

	private final ObjectMapper objectMapper;

	public JsonMapCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public String serialize(Map<String, Object> value) {
		try {
			return objectMapper.writeValueAsString(value == null ? Map.of() : value);
		} catch (Exception e) {
			throw new IllegalStateException("JSON 序列化失敗", e);
		}
	}

	/**
	 * @throws IllegalArgumentException JSON 格式錯誤或不是物件
	 */
	public Map<String, Object> deserialize(String json) {
		if (json == null || json.isBlank()) {
			return Map.of();
		}
		Map<String, Object> value;
		try {
			value = objectMapper.readValue(json, MAP_TYPE);
		} catch (Exception e) {
			throw new IllegalArgumentException("JSON 反序列化失敗", e);
		}
		if (value == null) {
			throw new IllegalArgumentException("JSON 內容不是物件");
		}
		return value;
	}
}
