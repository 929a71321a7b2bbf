package ai.sourcebridge.translator.cli;

import ai.sourcebridge.translator.lang.Language;
import picocli.CommandLine;

public class LanguageConverter implements CommandLine.ITypeConverter<Language> {

    @Override
    public Language convert(String value) {
        return Language.from(value);
    }
}
