package com.courier.delivery.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Command body accepted by the delivery endpoints: {@code {"type": "...", "data": {...}}}.
 *
 * @param type event type to apply
 * @param data event payload, may be omitted
 */
public record CommandRequest(@NotBlank String type, Map<String, Object> data) {}
