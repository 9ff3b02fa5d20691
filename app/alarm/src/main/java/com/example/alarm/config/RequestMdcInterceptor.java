package com.example.alarm.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String USER_ID_HEADER = "X-User-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = firstNonBlank(request.getHeader(REQUEST_ID_HEADER), UUID.randomUUID().toString());
    // echo back so push registration failures can be matched to server logs
    response.setHeader(REQUEST_ID_HEADER, requestId);

    final List<String> keys = new ArrayList<>();
    put(keys, "request_id", requestId);
    put(keys, "http_method", request.getMethod());
    put(keys, "http_path", request.getRequestURI());
    put(keys, "client_ip", clientIp(request));
    put(keys, "user_id", request.getHeader(USER_ID_HEADER));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys) {
      rawKeys.stream().filter(String.class::isInstance).map(String.class::cast).forEach(MDC::remove);
    }
  }

  private String clientIp(HttpServletRequest request) {
    final String forwarded = request.getHeader("X-Forwarded-For");
    if (forwarded == null || forwarded.isBlank()) {
      return request.getRemoteAddr();
    }
    // first hop is the original client
    return forwarded.split(",", 2)[0].trim();
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private void put(List<String> keys, String key, String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
      keys.add(key);
    }
  }
}
