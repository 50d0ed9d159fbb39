package io.queryparams.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class TextCodecsTest {

    enum Genre { FICTION, SCIENCE }

    @Test
    void numericCodecsDecodeOrReturnEmpty() {
        assertThat(TextCodecs.integer().decode("42")).contains(42);
        assertThat(TextCodecs.integer().decode("-7")).contains(-7);
        assertThat(TextCodecs.integer().decode("xyz")).isEmpty();
        assertThat(TextCodecs.integer().decode("")).isEmpty();
        assertThat(TextCodecs.integer().decode("99999999999")).isEmpty();
        assertThat(TextCodecs.longs().decode("99999999999")).contains(99999999999L);
        assertThat(TextCodecs.doubles().decode("1.5")).contains(1.5);
        assertThat(TextCodecs.decimal().decode("12.30")).contains(new BigDecimal("12.30"));
        assertThat(TextCodecs.decimal().decode("1e")).isEmpty();
    }

    @Test
    void boolCodecIsStrict() {
        assertThat(TextCodecs.bool().decode("true")).contains(true);
        assertThat(TextCodecs.bool().decode("false")).contains(false);
        assertThat(TextCodecs.bool().decode("TRUE")).isEmpty();
        assertThat(TextCodecs.bool().decode("1")).isEmpty();
    }

    @Test
    void temporalAndUuidCodecs() {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertThat(TextCodecs.uuid().decode(id.toString())).contains(id);
        assertThat(TextCodecs.uuid().decode("not-a-uuid")).isEmpty();
        assertThat(TextCodecs.localDate().decode("2024-02-29")).contains(LocalDate.of(2024, 2, 29));
        assertThat(TextCodecs.localDate().decode("2023-02-29")).isEmpty();
        assertThat(TextCodecs.localDateTime().decode("2024-05-01T10:15:30")).isPresent();
    }

    @Test
    void enumCodecUsesConstantNames() {
        TextCodec<Genre> codec = TextCodecs.enumOf(Genre.class);

        assertThat(codec.decode("SCIENCE")).contains(Genre.SCIENCE);
        assertThat(codec.decode("science")).isEmpty();
        assertThat(codec.encode(Genre.FICTION)).isEqualTo("FICTION");
    }

    @Test
    void encodeThenDecodeReturnsTheValue() {
        assertThat(TextCodecs.integer().decode(TextCodecs.integer().encode(-12))).contains(-12);
        assertThat(TextCodecs.decimal().decode(TextCodecs.decimal().encode(new BigDecimal("1E+3"))))
                .contains(new BigDecimal("1000"));
        assertThat(TextCodecs.string().decode(TextCodecs.string().encode("a b&c"))).contains("a b&c");
    }
}
