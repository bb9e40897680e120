package yggdrasil.storage.service;

import org.junit.jupiter.api.Test;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ClassificationInput;
import yggdrasil.storage.dto.ContentProfile;

import static org.assertj.core.api.Assertions.assertThat;

public class ContentClassifierTest {

    private static final String ESSAY = "# Consciousness and Existence\n\n"
        + "Philosophy has long asked what consciousness is. Metaphysics studies existence itself. "
        + "Ethics follows from how we understand the self. Logic constrains every argument we make.\n\n"
        + "1. The problem of other minds\n"
        + "Consciousness appears private, yet philosophy insists on shared reasons. "
        + "Existence precedes essence, some argue, while others defend a strict metaphysics of substance.\n\n"
        + "See https://plato.stanford.edu for references on consciousness and metaphysics.";

    private final ContentClassifier classifier = new ContentClassifier(new StorageProperties());

    @Test
    public void classificationIsDeterministic() {
        ClassificationInput input = ClassificationInput.builder()
            .text(ESSAY).declaredSize(ESSAY.length()).domain("philosophy").contentType("article").build();

        ContentProfile first = classifier.classify(input);
        ContentProfile second = classifier.classify(input);

        assertThat(second).isEqualTo(first);
    }

    @Test
    public void scoresStayInUnitInterval() {
        ContentProfile profile = classifier.classify(ClassificationInput.builder()
            .text(ESSAY).declaredSize(ESSAY.length()).domain("philosophy").contentType("book").build());

        assertThat(profile.getSemanticComplexity()).isBetween(0.0, 1.0);
        assertThat(profile.getTopicCoherence()).isBetween(0.0, 1.0);
        assertThat(profile.getInformationDensity()).isBetween(0.0, 1.0);
        assertThat(profile.getQueryPotential()).isBetween(0.0, 1.0);
        assertThat(profile.getKeywords()).contains("consciousness", "metaphysics");
        assertThat(profile.getCharacterCount()).isEqualTo(ESSAY.length());
    }

    @Test
    public void emptyTextYieldsZeroedProfile() {
        ContentProfile profile = classifier.classify(ClassificationInput.builder()
            .text("").declaredSize(0).build());

        assertThat(profile.getSemanticComplexity()).isZero();
        assertThat(profile.getInformationDensity()).isZero();
        assertThat(profile.getWordCount()).isZero();
        assertThat(profile.getKeywords()).isEmpty();
    }

    @Test
    public void highValueDomainRaisesQueryPotential() {
        ClassificationInput general = ClassificationInput.builder()
            .text(ESSAY).declaredSize(ESSAY.length()).domain("general").contentType("article").build();
        ClassificationInput philosophy = ClassificationInput.builder()
            .text(ESSAY).declaredSize(ESSAY.length()).domain("philosophy").contentType("article").build();

        assertThat(classifier.classify(philosophy).getQueryPotential())
            .isGreaterThan(classifier.classify(general).getQueryPotential());
    }

    @Test
    public void infersDomainFromKeywords() {
        assertThat(classifier.inferDomain(ESSAY, "https://example.org/essay")).isEqualTo("philosophy");
        assertThat(classifier.inferDomain("nothing to see", "https://example.org/x")).isEqualTo("general");
        assertThat(classifier.inferDomain("", "https://example.org/software-algorithm-programming"))
            .isEqualTo("technology");
    }

    @Test
    public void infersContentTypeFromLocatorThenSize() {
        assertThat(classifier.inferContentType("https://www.gutenberg.org/ebooks/1342", 10)).isEqualTo("book");
        assertThat(classifier.inferContentType("https://arxiv.org/abs/2101.00001", 10)).isEqualTo("academic_paper");
        assertThat(classifier.inferContentType("https://en.wikipedia.org/wiki/Logic", 10)).isEqualTo("reference");
        assertThat(classifier.inferContentType("https://example.org/a", 2_000_000L)).isEqualTo("large_document");
        assertThat(classifier.inferContentType("https://example.org/a", 200_000L)).isEqualTo("medium_document");
        assertThat(classifier.inferContentType("https://example.org/a", 2_000L)).isEqualTo("small_document");
    }
}
