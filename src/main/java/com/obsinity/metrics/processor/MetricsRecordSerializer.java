package com.obsinity.metrics.processor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.obsinity.metrics.model.ContextRecord;

/** Renders a {@link ContextRecord} as a single-line JSON object. */
public class MetricsRecordSerializer {

	private final ObjectMapper mapper;

	public MetricsRecordSerializer() {
		this(null);
	}

	public MetricsRecordSerializer(ObjectMapper mapper) {
		// Use the application mapper if provided, but never pretty-print: one record, one line.
		if (mapper != null) {
			this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
		} else {
			this.mapper = new ObjectMapper();
		}
	}

	/**
	 * @throws MetricsSerializationException if any field value has no JSON representation
	 */
	public String serialize(final ContextRecord record) {
		try {
			return mapper.writeValueAsString(record);
		} catch (JsonProcessingException e) {
			throw new MetricsSerializationException("Cannot serialize metrics context: " + e.getOriginalMessage(), e);
		}
	}
}
