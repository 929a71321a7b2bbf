package ai.sourcebridge.translator.cli;

import ai.sourcebridge.translator.annotate.AnnotationMode;
import picocli.CommandLine;

public class AnnotationModeConverter implements CommandLine.ITypeConverter<AnnotationMode> {

    @Override
    public AnnotationMode convert(String value) {
        return AnnotationMode.from(value);
    }
}
