package io.swimset.workout.cli;

import io.swimset.workout.config.OutputFormat;
import picocli.CommandLine;

public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {

    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
