package org.csu.minic.common.config;

import lombok.Getter;
import lombok.Setter;
import org.csu.minic.common.log.CompilerLogger;
import org.slf4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * @author hidyouth
 * @description: 编译器的可配置项
 *
 * 默认值可以通过 classpath 下的 minic.properties 覆盖，命令行参数再覆盖它。
 */
@Getter
@Setter
public class CompilerSettings {

    private static final Logger LOGGER = CompilerLogger.getLogger(CompilerSettings.class);

    public static final String RESOURCE_NAME = "minic.properties";
    public static final String OPERATOR_MATCHING_KEY = "minic.lexer.operator-matching";
    public static final String UNKNOWN_CHARACTER_KEY = "minic.lexer.unknown-character";

    private OperatorMatching operatorMatching = OperatorMatching.LONGEST_MATCH;
    private UnknownCharacterPolicy unknownCharacterPolicy = UnknownCharacterPolicy.FAIL;

    public CompilerSettings() {
    }

    public CompilerSettings(OperatorMatching operatorMatching, UnknownCharacterPolicy unknownCharacterPolicy) {
        this.operatorMatching = Objects.requireNonNull(operatorMatching, "operatorMatching");
        this.unknownCharacterPolicy = Objects.requireNonNull(unknownCharacterPolicy, "unknownCharacterPolicy");
    }

    public CompilerSettings copy() {
        return new CompilerSettings(operatorMatching, unknownCharacterPolicy);
    }

    /**
     * 从 Properties 中读取配置，缺省的键保持默认值。枚举名大小写不敏感，"-" 等价于 "_"。
     */
    public static CompilerSettings fromProperties(Properties properties) {
        CompilerSettings settings = new CompilerSettings();
        String matching = properties.getProperty(OPERATOR_MATCHING_KEY);
        if (matching != null) {
            settings.setOperatorMatching(parseEnum(OperatorMatching.class, OPERATOR_MATCHING_KEY, matching));
        }
        String unknown = properties.getProperty(UNKNOWN_CHARACTER_KEY);
        if (unknown != null) {
            settings.setUnknownCharacterPolicy(parseEnum(UnknownCharacterPolicy.class, UNKNOWN_CHARACTER_KEY, unknown));
        }
        return settings;
    }

    /**
     * 加载 classpath 上的 minic.properties；文件不存在时返回默认配置。
     */
    public static CompilerSettings loadDefaults() {
        return load(CompilerSettings.class.getClassLoader(), RESOURCE_NAME);
    }

    static CompilerSettings load(ClassLoader classLoader, String resourceName) {
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                LOGGER.debug("No {} on the classpath, using built-in defaults", resourceName);
                return new CompilerSettings();
            }
            Properties properties = new Properties();
            properties.load(in);
            CompilerSettings settings = fromProperties(properties);
            LOGGER.debug("Loaded settings from {}: {}", resourceName, settings);
            return settings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resourceName, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + key, e);
        }
    }

    @Override
    public String toString() {
        return "CompilerSettings[operatorMatching=" + operatorMatching
                + ", unknownCharacterPolicy=" + unknownCharacterPolicy + "]";
    }
}
