package ai.masked.translator.cli;

import ai.masked.translator.config.ConfigLoader;
import ai.masked.translator.config.LogFormat;
import ai.masked.translator.translate.TranslationFormat;
import ai.masked.translator.validation.RepairFeature;
import java.net.URI;
import picocli.CommandLine;

/**
 * picocli converters for option types that need lenient parsing.
 */
final class CliConverters {

    private CliConverters() {
    }

    static final class FormatConverter implements CommandLine.ITypeConverter<TranslationFormat> {
        @Override
        public TranslationFormat convert(String value) {
            return TranslationFormat.from(value);
        }
    }

    static final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
        @Override
        public LogFormat convert(String value) {
            return LogFormat.from(value);
        }
    }

    static final class RepairFeatureConverter implements CommandLine.ITypeConverter<RepairFeature> {
        @Override
        public RepairFeature convert(String value) {
            return RepairFeature.from(value);
        }
    }

    static final class ProxyConverter implements CommandLine.ITypeConverter<URI> {
        @Override
        public URI convert(String value) {
            return ConfigLoader.parseProxy(value);
        }
    }
}
