package io.github.reugn.arbitrary4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.arbitrary4j.util.CompileHelper.compile;

/**
 * Tests for the source generated from {@code @Arbitrary} and {@code @IncludeArbitrary}.
 * <p>
 * For compile errors, see {@link ValidationTest}.
 */
@DisplayName("Descriptor generation")
class DescriptorGenerationTest {

    private static final String SERVICES_FILE =
            "META-INF/services/io.github.reugn.arbitrary4j.descriptor.RecordDescriptor";

    @Nested
    @DisplayName("@Arbitrary")
    class AnnotatedRecords {

        @Test
        @DisplayName("Generate descriptor for a simple record")
        void simpleRecord() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Customer",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Customer(String name, Integer age, String email) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.CustomerArbitrary")
                    .contentsAsUtf8String()
                    .contains("extends AbstractRecordDescriptor<Customer>");
            assertThat(compilation).generatedSourceFile("test.CustomerArbitrary")
                    .contentsAsUtf8String()
                    .contains("FieldDescriptor.of(1, \"age\", FieldType.integral(Integer.class))");
            assertThat(compilation).generatedSourceFile("test.CustomerArbitrary")
                    .contentsAsUtf8String()
                    .contains("case 2 -> instance.email();");
        }

        @Test
        @DisplayName("Nested member record is named after its enclosing type")
        void nestedRecord() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Shop",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            public class Shop {
                                @Arbitrary
                                public record Item(String sku, long price) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.Shop_ItemArbitrary")
                    .contentsAsUtf8String()
                    .contains("super(Shop.Item.class");
        }

        @Test
        @DisplayName("Record without components")
        void emptyRecord() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Marker",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            record Marker() {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.MarkerArbitrary");
        }

        @Test
        @DisplayName("Record in the unnamed package")
        void unnamedPackage() {
            JavaFileObject source = JavaFileObjects.forSourceString("Point",
                    """
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Point(int x, int y) {}
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("PointArbitrary");
        }

        @Test
        @DisplayName("Services file lists every descriptor")
        void servicesFile() {
            JavaFileObject customer = JavaFileObjects.forSourceString("test.Customer",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Customer(String name) {}
                            """);
            JavaFileObject order = JavaFileObjects.forSourceString("test.Order",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Order(Long id, Customer customer) {}
                            """);

            Compilation compilation = compile(customer, order);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedFile(StandardLocation.CLASS_OUTPUT, SERVICES_FILE)
                    .contentsAsUtf8String()
                    .isEqualTo("test.CustomerArbitrary\ntest.OrderArbitrary\n");
            assertThat(compilation).hadNoteContaining("registered 2 record descriptor(s)");
        }
    }

    @Nested
    @DisplayName("Field types")
    class FieldTypes {

        @Test
        @DisplayName("Every supported shape compiles")
        void supportedShapes() {
            JavaFileObject status = JavaFileObjects.forSourceString("test.Status",
                    """
                            package test;
                            
                            public enum Status { ACTIVE, SUSPENDED }
                            """);
            JavaFileObject source = JavaFileObjects.forSourceString("test.Account",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            import java.time.Instant;
                            import java.time.LocalDate;
                            import java.util.*;
                            
                            @Arbitrary
                            public record Account(
                                    byte b, short s, int i, long l, boolean flag, double ratio, char letter,
                                    Byte boxedByte, Boolean boxedFlag,
                                    String userEmail, Status status,
                                    Optional<String> nickname, OptionalInt rank, OptionalLong big, OptionalDouble score,
                                    List<String> tags, Set<Status> statuses, SortedSet<String> sorted,
                                    NavigableSet<Long> navigable, Collection<Integer> numbers, Iterable<String> iterable,
                                    Map<String, List<Long>> limits, SortedMap<String, Integer> sortedLimits,
                                    NavigableMap<Long, String> navigableLimits,
                                    String[] aliases, int[][] matrix, List<? extends Number> bounded,
                                    @SuppressWarnings("rawtypes") List raw,
                                    Instant createdAt, LocalDate birthday, UUID trackingId) {}
                            """);

            Compilation compilation = compile(status, source);
            assertThat(compilation).succeeded();
            String generated = "test.AccountArbitrary";
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.integral(byte.class)");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.other(double.class)");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.enumeration(Status.class)");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.optionalInt()");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.map(FieldType.text(), FieldType.list(FieldType.integral(Long.class)))");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.array(new int[0][], FieldType.array(new int[0], FieldType.integral(int.class)))");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.list(FieldType.other(Number.class))");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.list(FieldType.other(Object.class))");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.temporal(Instant.class)");
            assertThat(compilation).generatedSourceFile(generated).contentsAsUtf8String()
                    .contains("FieldType.other(UUID.class)");
        }

        @Test
        @DisplayName("Nested record component")
        void nestedComponent() {
            JavaFileObject source = JavaFileObjects.forSourceString("test.Order",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Order(Long id, Address shipping) {
                                public record Address(String city) {}
                            }
                            """);

            Compilation compilation = compile(source);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.OrderArbitrary").contentsAsUtf8String()
                    .contains("FieldType.nested(Order.Address.class)");
        }
    }

    @Nested
    @DisplayName("@IncludeArbitrary")
    class IncludedRecords {

        @Test
        @DisplayName("Generate descriptor for an external record in the holder's package")
        void externalRecord() {
            JavaFileObject external = JavaFileObjects.forSourceString("lib.Money",
                    """
                            package lib;
                            
                            public record Money(Long amount, String currency) {}
                            """);
            JavaFileObject holder = JavaFileObjects.forSourceString("test.TestRecords",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.IncludeArbitrary;
                            import lib.Money;
                            
                            @IncludeArbitrary(Money.class)
                            class TestRecords {}
                            """);

            Compilation compilation = compile(external, holder);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.MoneyArbitrary")
                    .contentsAsUtf8String()
                    .contains("extends AbstractRecordDescriptor<Money>");
            assertThat(compilation).generatedFile(StandardLocation.CLASS_OUTPUT, SERVICES_FILE)
                    .contentsAsUtf8String()
                    .contains("test.MoneyArbitrary");
        }

        @Test
        @DisplayName("Several records")
        void severalRecords() {
            JavaFileObject records = JavaFileObjects.forSourceString("test.External",
                    """
                            package test;
                            
                            public class External {
                                public record Money(Long amount) {}
                                public record Address(String city) {}
                            }
                            """);
            JavaFileObject holder = JavaFileObjects.forSourceString("test.TestRecords",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.IncludeArbitrary;
                            
                            @IncludeArbitrary({External.Money.class, External.Address.class})
                            class TestRecords {}
                            """);

            Compilation compilation = compile(records, holder);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.External_MoneyArbitrary");
            assertThat(compilation).generatedSourceFile("test.External_AddressArbitrary");
        }

        @Test
        @DisplayName("Annotated and included in the same package yields one descriptor")
        void annotatedAndIncluded() {
            JavaFileObject record = JavaFileObjects.forSourceString("test.Customer",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.Arbitrary;
                            
                            @Arbitrary
                            public record Customer(String name) {}
                            """);
            JavaFileObject holder = JavaFileObjects.forSourceString("test.TestRecords",
                    """
                            package test;
                            
                            import io.github.reugn.arbitrary4j.annotation.IncludeArbitrary;
                            
                            @IncludeArbitrary(Customer.class)
                            class TestRecords {}
                            """);

            Compilation compilation = compile(record, holder);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedFile(StandardLocation.CLASS_OUTPUT, SERVICES_FILE)
                    .contentsAsUtf8String()
                    .isEqualTo("test.CustomerArbitrary\n");
        }
    }
}
