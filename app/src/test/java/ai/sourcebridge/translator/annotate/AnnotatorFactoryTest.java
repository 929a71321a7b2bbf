package ai.sourcebridge.translator.annotate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AnnotatorFactoryTest {

    @Test
    void createsModelAnnotatorOnlyWhenAiModeIsRequested() {
        AtomicInteger created = new AtomicInteger();
        Annotator aiAnnotator = (code, language) -> code;
        AnnotatorFactory factory = new AnnotatorFactory(() -> {
            created.incrementAndGet();
            return aiAnnotator;
        }, new PassThroughAnnotator(), new MockAnnotator());

        assertThat(factory.select(AnnotationMode.NONE)).isInstanceOf(PassThroughAnnotator.class);
        assertThat(factory.select(AnnotationMode.MOCK)).isInstanceOf(MockAnnotator.class);
        assertThat(created.get()).isZero();

        assertThat(factory.select(AnnotationMode.AI)).isSameAs(aiAnnotator);
        assertThat(factory.select(AnnotationMode.AI)).isSameAs(aiAnnotator);
        assertThat(created.get()).isEqualTo(1);
    }

    @Test
    void parsesModeNamesIgnoringCase() {
        assertThat(AnnotationMode.from(" Mock ")).isEqualTo(AnnotationMode.MOCK);
        assertThat(AnnotationMode.from("ai")).isEqualTo(AnnotationMode.AI);
        assertThat(AnnotationMode.from("")).isEqualTo(AnnotationMode.NONE);
        assertThatThrownBy(() -> AnnotationMode.from("loud"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported annotation mode: loud");
    }
}
