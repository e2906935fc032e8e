package io.ucmsdk.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ucmsdk.core.error.SchemaParseException;
import io.ucmsdk.core.model.FieldKind;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.model.PrimitiveType;
import io.ucmsdk.core.testkit.TestSchemas;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DescriptorSchemaParser")
class DescriptorSchemaParserTest {

    private final DescriptorSchemaParser parser = new DescriptorSchemaParser();

    private List<OperationSchema> parse(String yaml) {
        return parser.parse(SchemaSource.descriptor(null, "test.yaml", yaml));
    }

    private Map<String, OperationSchema> parseFixture() {
        return parser.parse(TestSchemas.descriptor(TestSchemas.AXL_DESCRIPTOR)).stream()
                .collect(Collectors.toMap(OperationSchema::name, Function.identity()));
    }

    @Nested
    @DisplayName("AXL fixture")
    class AxlFixture {

        @Test
        void parsesEveryOperationWithDeclaredVersion() {
            Map<String, OperationSchema> ops = parseFixture();

            assertThat(ops).containsOnlyKeys(
                    "getPhone", "listPhone", "addPhone", "updatePhone", "removePhone", "getUser", "addUser", "getLine",
                    "getCCMVersion");
            assertThat(ops.values()).allSatisfy(op -> assertThat(op.apiVersion()).isEqualTo("14.0"));
        }

        @Test
        void namedTypesExpandInline() {
            FieldSpec phone = parseFixture().get("addPhone").requestField("phone");

            assertThat(phone.required()).isTrue();
            assertThat(phone.kind()).isEqualTo(FieldKind.OBJECT);
            assertThat(phone.children())
                    .extracting(FieldSpec::name)
                    .containsExactly(
                            "name", "description", "product", "model", "protocol", "devicePoolName",
                            "enableExtensionMobility", "lines");

            FieldSpec lines = phone.child("lines");
            assertThat(lines.repeated()).isTrue();
            assertThat(lines.child("directoryNumber").required()).isTrue();
            assertThat(lines.child("index").primitiveType()).isEqualTo(PrimitiveType.INTEGER);
        }

        @Test
        void enumsDefaultsAndShorthand() {
            FieldSpec phone = parseFixture().get("addPhone").requestField("phone");

            assertThat(phone.child("model").enumValues()).containsExactly("7841", "8865");
            assertThat(phone.child("protocol").defaultValue()).isEqualTo("SIP");
            assertThat(phone.child("description").primitiveType()).isEqualTo(PrimitiveType.STRING);
            assertThat(phone.child("description").required()).isFalse();
        }

        @Test
        void choiceGroupsAreKept() {
            OperationSchema getPhone = parseFixture().get("getPhone");

            assertThat(getPhone.request().choiceGroups().get("phoneKey"))
                    .extracting(FieldSpec::name)
                    .containsExactly("name", "uuid");
        }

        @Test
        void branchesAndLengthLimitsAreKept() {
            Map<String, OperationSchema> ops = parseFixture();
            OperationSchema getLine = ops.get("getLine");

            assertThat(getLine.requestField("uuid").choiceBranch()).isNull();
            assertThat(getLine.requestField("pattern").choiceBranch()).isEqualTo("byPattern");
            assertThat(getLine.requestField("routePartitionName").choiceAlternative()).isEqualTo("byPattern");
            assertThat(ops.get("addPhone").requestField("phone").child("lines").child("display").maxLength())
                    .isEqualTo(50);
        }

        @Test
        void responseRootIsNamedAfterOperation() {
            OperationSchema getPhone = parseFixture().get("getPhone");

            assertThat(getPhone.request().name()).isEqualTo("getPhone");
            assertThat(getPhone.response().name()).isEqualTo("getPhoneResponse");
            assertThat(getPhone.responseField("return").child("phone").child("lastRegistered").primitiveType())
                    .isEqualTo(PrimitiveType.DATE_TIME);
        }
    }

    @Nested
    @DisplayName("Version resolution")
    class Versions {

        private static final String BODY = "operations:\n  getCCMVersion:\n    response:\n      return: string\n";

        @Test
        void sourceVersionIsUsedWhenDescriptorHasNone() {
            List<OperationSchema> ops = parser.parse(SchemaSource.descriptor("12.5.1.10000-1", "x.yaml", BODY));

            assertThat(ops).singleElement().satisfies(op -> assertThat(op.apiVersion()).isEqualTo("12.5"));
        }

        @Test
        void missingVersionEverywhereFails() {
            assertThatThrownBy(() -> parse(BODY))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("No API version");
        }

        @Test
        void conflictingVersionsFail() {
            assertThatThrownBy(() -> parser.parse(SchemaSource.descriptor("12.5", "x.yaml", "version: '14.0'\n" + BODY)))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("declares version 14.0 but was loaded as 12.5");
        }

        @Test
        void numericVersionIsAccepted() {
            assertThat(parse("version: 15\n" + BODY)).singleElement()
                    .satisfies(op -> assertThat(op.apiVersion()).isEqualTo("15.0"));
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        void unknownFieldKey() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      getPhone:
                        request:
                          name: { type: string, requried: true }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Unknown key in 'operations.getPhone.request.name': [requried]")
                    .satisfies(e -> assertThat(((SchemaParseException) e).source()).isEqualTo("test.yaml"));
        }

        @Test
        void unknownRootKey() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operation:
                      getPhone: {}
                    operations:
                      getPhone: {}
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("descriptor root");
        }

        @Test
        void unknownTypeReference() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      addPhone:
                        request:
                          phone: XPhone
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("unknown type 'XPhone'");
        }

        @Test
        void recursiveType() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    types:
                      Node:
                        fields:
                          child: Node
                    operations:
                      walk:
                        request:
                          root: Node
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("recursive");
        }

        @Test
        void sameTypeUsedTwiceIsNotRecursion() {
            List<OperationSchema> ops = parse("""
                    version: "14.0"
                    types:
                      Ref:
                        fields:
                          name: string
                    operations:
                      copy:
                        request:
                          from: Ref
                          to: Ref
                    """);

            assertThat(ops.get(0).request().children()).extracting(FieldSpec::name).containsExactly("from", "to");
        }

        @Test
        void duplicateFieldName() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      getPhone:
                        request:
                          name: string
                          name: integer
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Duplicate field 'name'");
        }

        @Test
        void moreThanOneShapeKey() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      getPhone:
                        request:
                          model: { type: string, enum: ["7841"] }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("exactly one of 'type', 'enum' or 'fields'");
        }

        @Test
        void defaultMustFitTheType() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      listPhone:
                        request:
                          first: { type: integer, default: many }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Invalid default for 'operations.listPhone.request.first'");
        }

        @Test
        void maxLengthOnlyForStrings() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      listPhone:
                        request:
                          first: { type: integer, maxLength: 3 }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("maxLength applies only to string fields, not 'first'");
        }

        @Test
        void maxLengthMustBePositive() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      addPhone:
                        request:
                          name: { type: string, maxLength: 0 }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("structurally invalid");
        }

        @Test
        void branchNeedsChoice() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      getLine:
                        request:
                          pattern: { type: string, branch: byPattern }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("names a choice branch but no choice group");
        }

        @Test
        void structureIsCheckedAgainstBundledSchema() {
            assertThatThrownBy(() -> parse("""
                    version: "14.0"
                    operations:
                      getPhone:
                        request:
                          name: { type: string, required: "yes" }
                    """))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("structurally invalid");
        }

        @Test
        void emptyOperations() {
            assertThatThrownBy(() -> parse("version: '14.0'\noperations: {}\n"))
                    .isInstanceOf(SchemaParseException.class);
        }

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> parse("version: '14.0'\noperations: [unclosed\n"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("Failed to parse schema descriptor");
        }

        @Test
        void nonMappingRoot() {
            assertThatThrownBy(() -> parse("- just\n- a list\n"))
                    .isInstanceOf(SchemaParseException.class)
                    .hasMessageContaining("must be a mapping");
        }
    }
}
