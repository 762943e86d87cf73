package io.github.vevoly.jdepcache.core.utils;

import org.slf4j.Logger;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * 支持国际化 (i18n) 日志输出的辅助类。
 * <p>
 * 日志代码中使用语言无关的消息键，消息模板根据当前 Locale 从 {@code i18n/jdepcache_messages*.properties} 中加载，
 * 并通过 {@link MessageFormat} 格式化参数。
 * <p>
 * Helper for internationalized (i18n) log output.
 * Logging code uses language-neutral message keys; templates are loaded for the current Locale from
 * {@code i18n/jdepcache_messages*.properties} and formatted with {@link MessageFormat}.
 *
 * @author vevoly
 */
public class I18nLogger {

    /**
     * 国际化资源文件的基础名称。
     * <p>
     * Base name of the message bundle.
     */
    static final String BUNDLE_BASE_NAME = "i18n.jdepcache_messages";

    private final Logger slf4jLogger;
    private final ResourceBundle resourceBundle;

    public I18nLogger(Logger slf4jLogger) {
        this(slf4jLogger, Locale.getDefault());
    }

    /**
     * 使用指定 Locale 构造 I18nLogger。
     * <p>
     * Constructs an I18nLogger for the given Locale.
     *
     * @param slf4jLogger 实际输出日志的 SLF4J Logger。/ The SLF4J logger doing the actual output.
     * @param locale      消息语言。/ The message locale.
     */
    public I18nLogger(Logger slf4jLogger, Locale locale) {
        this.slf4jLogger = slf4jLogger;
        this.resourceBundle = loadBundle(slf4jLogger, locale);
    }

    private static ResourceBundle loadBundle(Logger logger, Locale locale) {
        try {
            return ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale, I18nLogger.class.getClassLoader());
        } catch (MissingResourceException e) {
            // 找不到资源文件时不影响运行，后续日志输出原始 Key / Missing bundle: keep running and log raw keys
            logger.warn("Could not find i18n resource bundle '{}'. Internationalized logging is disabled.", BUNDLE_BASE_NAME);
            return null;
        }
    }

    public void debug(String key, Object... args) {
        if (slf4jLogger.isDebugEnabled()) {
            slf4jLogger.debug(format(key, args));
        }
    }

    public void info(String key, Object... args) {
        if (slf4jLogger.isInfoEnabled()) {
            slf4jLogger.info(format(key, args));
        }
    }

    public void warn(String key, Object... args) {
        if (slf4jLogger.isWarnEnabled()) {
            slf4jLogger.warn(format(key, args));
        }
    }

    /**
     * 根据消息键和参数生成最终的日志文本。
     * <p>
     * Builds the final log text from a message key and its arguments.
     */
    String format(String key, Object... args) {
        if (resourceBundle == null) {
            return "[i18n disabled] " + key;
        }
        try {
            return MessageFormat.format(resourceBundle.getString(key), args);
        } catch (MissingResourceException e) {
            return "!!! LOG KEY NOT FOUND: " + key + " !!!";
        } catch (IllegalArgumentException e) {
            return "!!! LOG FORMATTING ERROR for key: " + key + " !!!";
        }
    }
}
