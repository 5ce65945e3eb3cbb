package com.paperdex.app.api;

import lombok.Value;

/** Error body: {@code {"error": "<reason>"}}. */
@Value
public class ApiError {
  String error;
}
