package uk.gegc.lingocards.features.vocabulary.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.lingocards.BaseUnitTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UsageExamplesConverter Tests")
class UsageExamplesConverterTest extends BaseUnitTest {

    private final UsageExamplesConverter converter = new UsageExamplesConverter();

    @Test
    @DisplayName("stores examples as a JSON array and reads them back in order")
    void storesJsonArray() {
        List<String> examples = List.of("Je mange une pomme.", "Nous mangeons \"ensemble\".", "");

        String column = converter.convertToDatabaseColumn(examples);

        assertThat(column).startsWith("[").endsWith("]");
        assertThat(converter.convertToEntityAttribute(column)).containsExactlyElementsOf(examples);
    }

    @Test
    @DisplayName("null list is stored as an empty array")
    void nullListStoredAsEmptyArray() {
        assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "not json", "{\"a\": 1}", "[\"unterminated"})
    @DisplayName("malformed column values read as an empty list")
    void malformedReadsAsEmpty(String column) {
        assertThat(converter.convertToEntityAttribute(column)).isEmpty();
    }
}
