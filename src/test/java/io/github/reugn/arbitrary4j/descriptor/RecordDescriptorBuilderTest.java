package io.github.reugn.arbitrary4j.descriptor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecordDescriptor.builder")
class RecordDescriptorBuilderTest {

    record Money(Long amount, String currency) {}

    private static RecordDescriptor<Money> money() {
        return RecordDescriptor.builder(Money.class)
                .field("amount", FieldType.integral(Long.class), Money::amount)
                .field("currency", FieldType.text(), Money::currency)
                .constructor(args -> new Money((Long) args[0], (String) args[1]))
                .build();
    }

    @Test
    @DisplayName("Fields in declaration order")
    void fields() {
        RecordDescriptor<Money> descriptor = money();

        assertThat(descriptor.type()).isEqualTo(Money.class);
        assertThat(descriptor.fields()).extracting(FieldDescriptor::index).containsExactly(0, 1);
        assertThat(descriptor.fields()).extracting(FieldDescriptor::toString)
                .containsExactly("amount: Long", "currency: String");
        assertThat(descriptor.field("currency")).isPresent();
        assertThat(descriptor.field("missing")).isEmpty();
    }

    @Test
    @DisplayName("Construct and read back")
    void constructAndRead() {
        RecordDescriptor<Money> descriptor = money();

        Money money = descriptor.construct(List.of(10L, "EUR"));

        assertThat(money).isEqualTo(new Money(10L, "EUR"));
        assertThat(descriptor.valueOf(money, descriptor.fields().get(1))).isEqualTo("EUR");
    }

    @Test
    @DisplayName("Wrong argument count")
    void wrongArgumentCount() {
        assertThatThrownBy(() -> money().construct(List.of(10L)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 2");
    }

    @Test
    @DisplayName("Field of another descriptor")
    void foreignField() {
        FieldDescriptor foreign = FieldDescriptor.of(1, "other", FieldType.text());

        assertThatThrownBy(() -> money().valueOf(new Money(1L, "USD"), foreign))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Missing constructor")
    void missingConstructor() {
        assertThatThrownBy(() -> RecordDescriptor.builder(Money.class)
                .field("amount", FieldType.integral(Long.class), Money::amount)
                .build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Duplicate field names")
    void duplicateNames() {
        assertThatThrownBy(() -> RecordDescriptor.builder(Money.class)
                .field("amount", FieldType.integral(Long.class), Money::amount)
                .field("amount", FieldType.text(), Money::currency)
                .constructor(args -> new Money((Long) args[0], (String) args[1]))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    @DisplayName("Field descriptor validation")
    void fieldDescriptorValidation() {
        assertThatThrownBy(() -> FieldDescriptor.of(-1, "x", FieldType.text()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FieldDescriptor.of(0, " ", FieldType.text()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(FieldDescriptor.of(0, "nick", FieldType.optional(FieldType.text())).optional()).isTrue();
    }
}
