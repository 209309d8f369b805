/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import ch.qos.logback.core.LayoutBase;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import java.time.Instant;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One JSON object per line. {@code key=value} pairs in the message (for example {@code code=} and
 * {@code op=}) are also lifted into a {@code fields} object so log shippers can index them.
 */
final class TradepostJsonLayout extends LayoutBase<ILoggingEvent> {
  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final Pattern FIELD = Pattern.compile("(?:^|\\s)([a-zA-Z]+)=(\\S+)");

  @Override
  public String doLayout(ILoggingEvent event) {
    JsonObject json = new JsonObject();
    json.addProperty("ts", Instant.ofEpochMilli(event.getTimeStamp()).toString());
    json.addProperty("level", event.getLevel().toString());
    json.addProperty("logger", event.getLoggerName());
    json.addProperty("thread", event.getThreadName());
    String message = event.getFormattedMessage();
    json.addProperty("message", message);

    JsonObject fields = extractFields(message);
    if (fields.size() > 0) {
      json.add("fields", fields);
    }

    Map<String, String> mdc = event.getMDCPropertyMap();
    if (mdc != null && !mdc.isEmpty()) {
      JsonObject ctx = new JsonObject();
      mdc.forEach(ctx::addProperty);
      json.add("mdc", ctx);
    }

    IThrowableProxy throwable = event.getThrowableProxy();
    if (throwable != null) {
      json.addProperty("stack", ThrowableProxyUtil.asString(throwable));
    }
    return GSON.toJson(json) + System.lineSeparator();
  }

  static JsonObject extractFields(String message) {
    JsonObject fields = new JsonObject();
    if (message == null) {
      return fields;
    }
    Matcher m = FIELD.matcher(message);
    while (m.find()) {
      if (!fields.has(m.group(1))) {
        fields.addProperty(m.group(1), m.group(2));
      }
    }
    return fields;
  }
}
