package io.github.reugn.arbitrary4j;

import io.github.reugn.arbitrary4j.TestRecords.Account;
import io.github.reugn.arbitrary4j.TestRecords.Address;
import io.github.reugn.arbitrary4j.TestRecords.Counter;
import io.github.reugn.arbitrary4j.TestRecords.Customer;
import io.github.reugn.arbitrary4j.TestRecords.Invoice;
import io.github.reugn.arbitrary4j.TestRecords.Order;
import io.github.reugn.arbitrary4j.TestRecords.Status;
import io.github.reugn.arbitrary4j.exception.ArbitraryException;
import io.github.reugn.arbitrary4j.exception.TypeMismatchException;
import io.github.reugn.arbitrary4j.exception.UnknownFieldException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Overrides")
class OverrideMergerTest {

    @Nested
    @DisplayName("Applying overrides")
    class Applying {

        @Test
        @DisplayName("Only the overridden field differs")
        void onlyOverriddenFieldDiffers() {
            Customer plain = TestRecords.generatorBuilder().counterStart(7).build()
                    .generate(Customer.class);
            Customer overridden = TestRecords.generatorBuilder().counterStart(7).build()
                    .generate(Customer.class, OverrideSet.of("email", "x@y.com"));

            assertThat(overridden.email()).isEqualTo("x@y.com");
            assertThat(overridden).isEqualTo(new Customer(plain.name(), plain.age(), "x@y.com"));
        }

        @Test
        @DisplayName("Several fields at once")
        void severalFields() {
            Account account = TestRecords.generator().generate(Account.class, OverrideSet.builder()
                    .set("status", Status.SUSPENDED)
                    .set("active", true)
                    .set("score", 99)
                    .set("tags", List.of("a", "b"))
                    .set("nickname", Optional.of("nick"))
                    .build());

            assertThat(account.status()).isEqualTo(Status.SUSPENDED);
            assertThat(account.active()).isTrue();
            assertThat(account.score()).isEqualTo(99);
            assertThat(account.tags()).containsExactly("a", "b");
            assertThat(account.nickname()).contains("nick");
        }

        @Test
        @DisplayName("null is accepted for reference fields")
        void nullForReference() {
            Customer customer = TestRecords.generator()
                    .generate(Customer.class, OverrideSet.builder().set("name", null).build());

            assertThat(customer.name()).isNull();
            assertThat(customer.age()).isEqualTo(2);
        }

        @Test
        @DisplayName("Nested field by dotted path")
        void dottedPath() {
            Order order = TestRecords.generator()
                    .generate(Order.class, OverrideSet.of("customer.email", "x@y.com", "shipping.city", "Oslo"));

            assertThat(order.customer().email()).isEqualTo("x@y.com");
            assertThat(order.customer().name()).isEqualTo("arbitrary-2");
            assertThat(order.shipping()).isEqualTo(new Address("arbitrary-5", "Oslo"));
        }

        @Test
        @DisplayName("Whole nested record")
        void wholeNestedRecord() {
            Customer customer = new Customer("Ann", 30, "ann@example.com");

            Order order = TestRecords.generator().generate(Order.class, OverrideSet.of("customer", customer));

            assertThat(order.customer()).isSameAs(customer);
        }

        @Test
        @DisplayName("Two levels deep")
        void twoLevels() {
            Invoice invoice = TestRecords.generator()
                    .generate(Invoice.class, OverrideSet.of("order.customer.age", 42));

            assertThat(invoice.order().customer().age()).isEqualTo(42);
            assertThat(invoice.order().id()).isEqualTo(2L);
        }

        @Test
        @DisplayName("Empty override set returns the generated instance")
        void emptyOverrides() {
            Customer customer = TestRecords.generator().generate(Customer.class, OverrideSet.empty());

            assertThat(customer).isEqualTo(new Customer("arbitrary-1", 2, "random-3@example.com"));
        }

        @Test
        @DisplayName("Input instance is not mutated")
        void noMutation() {
            ArbitraryGenerator generator = TestRecords.generator();
            OverrideMerger merger = new OverrideMerger(
                    new TypeIntrospector(TestRecords.ALL, Thread.currentThread().getContextClassLoader()));
            Customer original = generator.generate(Customer.class);

            Customer merged = merger.merge(original, TestRecords.CUSTOMER, OverrideSet.of("name", "changed"),
                    FieldPath.root(Customer.class));

            assertThat(merged).isNotSameAs(original);
            assertThat(merged.name()).isEqualTo("changed");
            assertThat(original.name()).isEqualTo("arbitrary-1");
        }
    }

    @Nested
    @DisplayName("Rejected overrides")
    class Rejected {

        @Test
        @DisplayName("Unknown field")
        void unknownField() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Customer.class, OverrideSet.of("nmae", "x")))
                    .isInstanceOf(UnknownFieldException.class)
                    .hasMessageContaining("nmae")
                    .hasMessageContaining("name: String")
                    .extracting("fieldPath").isEqualTo("Customer.nmae");
        }

        @Test
        @DisplayName("Wrong type")
        void wrongType() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Customer.class, OverrideSet.of("age", "old")))
                    .isInstanceOf(TypeMismatchException.class)
                    .hasMessageContaining("Integer")
                    .extracting("fieldPath").isEqualTo("Customer.age");
        }

        @Test
        @DisplayName("No numeric widening")
        void noWidening() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Customer.class, OverrideSet.of("age", 5L)))
                    .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("null for a primitive field")
        void nullForPrimitive() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Account.class, OverrideSet.builder().set("score", null).build()))
                    .isInstanceOf(TypeMismatchException.class)
                    .extracting("fieldPath").isEqualTo("Account.score");
        }

        @Test
        @DisplayName("null for an Optional field")
        void nullForOptional() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Account.class, OverrideSet.builder().set("nickname", null).build()))
                    .isInstanceOf(TypeMismatchException.class);
        }

        @Test
        @DisplayName("Dotted path through a non-record field")
        void dottedThroughScalar() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Order.class, OverrideSet.of("id.value", 1L)))
                    .isInstanceOf(UnknownFieldException.class)
                    .extracting("fieldPath").isEqualTo("Order.id.value");
        }

        @Test
        @DisplayName("Nested errors carry the full path")
        void nestedPath() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Invoice.class, OverrideSet.of("order.customer.age", "x")))
                    .isInstanceOf(TypeMismatchException.class)
                    .extracting("fieldPath").isEqualTo("Invoice.order.customer.age");
        }

        @Test
        @DisplayName("Dotted path into a null nested record")
        void dottedIntoNull() {
            ArbitraryGenerator generator = TestRecords.generator()
                    .registerRule(FieldMatcher.named("customer"), (field, context) -> null);

            assertThatThrownBy(() -> generator.generate(Order.class, OverrideSet.of("customer.name", "x")))
                    .isInstanceOf(UnknownFieldException.class)
                    .extracting("fieldPath").isEqualTo("Order.customer");
        }

        @Test
        @DisplayName("Constructor rejecting the override")
        void constructorRejects() {
            assertThatThrownBy(() -> TestRecords.generator()
                    .generate(Counter.class, OverrideSet.of("value", 0)))
                    .isInstanceOf(ArbitraryException.class)
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Valid entries are not applied when another entry is invalid")
        void allOrNothing() {
            OverrideSet overrides = OverrideSet.builder()
                    .set("name", "valid")
                    .set("unknown", "x")
                    .build();

            assertThatThrownBy(() -> TestRecords.generator().generate(Customer.class, overrides))
                    .isInstanceOf(UnknownFieldException.class);
        }
    }
}
