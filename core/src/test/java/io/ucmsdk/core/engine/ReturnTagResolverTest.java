package io.ucmsdk.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.ucmsdk.core.error.ReturnTagNotValidException;
import io.ucmsdk.core.model.FieldSpec;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.model.PrimitiveType;
import io.ucmsdk.core.testkit.TestSchemas;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ReturnTagResolver")
class ReturnTagResolverTest {

    private final ReturnTagResolver resolver = new ReturnTagResolver();

    @Test
    void selectedTagsOnly() {
        Map<String, Object> tags = resolver.resolve(TestSchemas.axl("getPhone"), List.of("model", "name"));

        assertThat(tags).containsOnlyKeys("model", "name").containsEntry("model", null).containsEntry("name", null);
        assertThat(tags.keySet()).containsExactly("model", "name");
    }

    @Test
    void objectTagExpandsToSubtree() {
        Map<String, Object> tags = resolver.resolve(TestSchemas.axl("getPhone"), List.of("lines"));

        Map<String, Object> lines = new HashMap<>();
        lines.put("index", null);
        lines.put("directoryNumber", null);
        assertThat(tags).containsEntry("lines", lines);
    }

    @Test
    void emptySelectionMeansAllTags() {
        assertThat(resolver.resolve(TestSchemas.axl("listPhone"), List.of()).keySet())
                .containsExactly("name", "description", "model", "devicePoolName", "lines");
        assertThat(resolver.resolve(TestSchemas.axl("listPhone"), null)).hasSize(5);
    }

    @Test
    void unknownTagListsValidOnes() {
        assertThatThrownBy(() -> resolver.resolve(TestSchemas.axl("getPhone"), List.of("mac")))
                .isInstanceOfSatisfying(ReturnTagNotValidException.class, e -> {
                    assertThat(e.fieldPath()).isEqualTo("returnedTags.mac");
                    assertThat(e.validTags()).containsExactly("name", "description", "model", "devicePoolName", "lines");
                    assertThat(e).hasMessageContaining("'mac' is not a valid return tag");
                });
    }

    @Test
    void operationWithoutReturnedTags() {
        assertThatThrownBy(() -> resolver.resolve(TestSchemas.axl("addPhone"), List.of("name")))
                .isInstanceOf(ReturnTagNotValidException.class)
                .hasMessage("addPhone (v14.0): operation does not accept return tags");
        assertThat(resolver.validTags(TestSchemas.axl("addPhone"))).isEmpty();
    }

    @Test
    void resolvedTagsPassVerification() {
        Map<String, Object> args = Map.of(
                "name", "SEP1", "returnedTags", resolver.resolve(TestSchemas.axl("getPhone"), List.of("lines")));

        assertThat(new SignatureVerifier().verify(TestSchemas.axl("getPhone"), args).isValid()).isTrue();
    }

    @Nested
    @DisplayName("Typed tags")
    class TypedTags {

        private final SignatureVerifier verifier = new SignatureVerifier();

        /** getPhone whose return tags have enum, boolean and integer leaves and a choice of line keys. */
        private OperationSchema getPhone() {
            FieldSpec lineTags = FieldSpec.builder("line")
                    .object(List.of(
                            FieldSpec.builder("dirn")
                                    .choiceGroup("lineKey")
                                    .object(List.of(FieldSpec.primitive("pattern", PrimitiveType.STRING)))
                                    .build(),
                            FieldSpec.builder("lineIdentifier")
                                    .choiceGroup("lineKey")
                                    .object(List.of(FieldSpec.primitive("directoryNumber", PrimitiveType.STRING)))
                                    .build(),
                            FieldSpec.builder("index").primitive(PrimitiveType.INTEGER).build()))
                    .build();
            FieldSpec returnedTags = FieldSpec.builder("returnedTags")
                    .object(List.of(
                            FieldSpec.primitive("name", PrimitiveType.STRING),
                            FieldSpec.enumeration("model", List.of("7841", "8865")),
                            FieldSpec.builder("protocol")
                                    .enumeration(List.of("SIP", "SCCP"))
                                    .required(true)
                                    .build(),
                            FieldSpec.primitive("isActive", PrimitiveType.BOOLEAN),
                            FieldSpec.primitive("numberOfButtons", PrimitiveType.INTEGER),
                            FieldSpec.builder("lines").object(List.of(lineTags)).build()))
                    .build();
            return new OperationSchema(
                    "getPhone",
                    "14.0",
                    FieldSpec.builder("getPhone")
                            .object(List.of(
                                    FieldSpec.builder("name").required(true).choiceGroup("phoneKey").build(),
                                    FieldSpec.builder("uuid").required(true).choiceGroup("phoneKey").build(),
                                    returnedTags))
                            .build(),
                    FieldSpec.builder("getPhoneResponse").object(List.of()).build());
        }

        private ValidationResult verifyWith(List<String> tags) {
            Map<String, Object> args = new HashMap<>();
            args.put("name", "SEP1");
            args.put("returnedTags", resolver.resolve(getPhone(), tags));
            return verifier.verify(getPhone(), args);
        }

        @Test
        void everyTagOnItsOwnPassesVerification() {
            for (String tag : resolver.validTags(getPhone())) {
                ValidationResult result = verifyWith(List.of(tag));

                assertThat(result.isValid()).as("tag %s: %s", tag, result.error()).isTrue();
            }
        }

        @Test
        void allTagsPassVerification() {
            assertThat(verifyWith(List.of()).isValid()).isTrue();
            assertThat(verifyWith(null).isValid()).isTrue();
        }

        @Test
        void requiredLeafGetsAValueOfItsType() {
            assertThat(resolver.resolve(getPhone(), List.of("protocol"))).containsEntry("protocol", "SIP");
        }

        @Test
        void onlyFirstChoiceAlternativeIsExpanded() {
            @SuppressWarnings("unchecked")
            Map<String, Object> line = (Map<String, Object>) ((Map<String, Object>) resolver
                    .resolve(getPhone(), List.of("lines"))
                    .get("lines"))
                    .get("line");

            assertThat(line.keySet()).containsExactly("dirn", "index");
        }

        @Test
        void branchMembersStayTogether() {
            FieldSpec tags = FieldSpec.builder("returnedTags")
                    .object(Arrays.asList(
                            FieldSpec.builder("pattern").choiceGroup("lineKey").choiceBranch("byPattern").build(),
                            FieldSpec.builder("routePartitionName")
                                    .choiceGroup("lineKey")
                                    .choiceBranch("byPattern")
                                    .build(),
                            FieldSpec.builder("uuid").choiceGroup("lineKey").build()))
                    .build();
            OperationSchema getLine = new OperationSchema(
                    "getLine",
                    "14.0",
                    FieldSpec.builder("getLine").object(List.of(tags)).build(),
                    FieldSpec.builder("getLineResponse").object(List.of()).build());

            assertThat(resolver.resolve(getLine, List.of()).keySet()).containsExactly("pattern", "routePartitionName");
        }
    }
}
