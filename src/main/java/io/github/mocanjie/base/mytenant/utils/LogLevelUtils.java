package io.github.mocanjie.base.mytenant.utils;

import lombok.extern.slf4j.Slf4j;

/**
 * 通过反射调整日志级别，不直接引用 Logback 类，换用其他日志实现时不会因缺类而加载失败
 */
@Slf4j
public class LogLevelUtils {

	private static final String LOGBACK_LEVEL_CLASS = "ch.qos.logback.classic.Level";

	private LogLevelUtils() {}

	/**
	 * @param loggerFactory {@code LoggerFactory.getILoggerFactory()} 的返回值
	 * @return 是否设置成功；非 Logback 实现返回 false
	 */
	public static boolean setLevel(Object loggerFactory, String loggerName, String level) {
		if (loggerFactory == null || !loggerFactory.getClass().getName().contains("logback")) {
			return false;
		}
		try {
			Object logger = loggerFactory.getClass().getMethod("getLogger", String.class).invoke(loggerFactory, loggerName);
			Class<?> levelClass = Class.forName(LOGBACK_LEVEL_CLASS, false, loggerFactory.getClass().getClassLoader());
			Object levelObj = levelClass.getField(level).get(null);
			logger.getClass().getMethod("setLevel", levelClass).invoke(logger, levelObj);
			return true;
		} catch (ReflectiveOperationException | RuntimeException e) {
			log.warn("无法设置日志级别 {}={}: {}", loggerName, level, e.toString());
			return false;
		}
	}
}
