package io.ucmsdk.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Tests for the exception hierarchy. Verifies the four families, their common
 * fields and the context attached to transport failures.
 */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void ucmSdkExceptionIsAbstractAndRoot() {
        assertThat(UcmSdkException.class).isAbstract();
        assertThat(UcmSdkException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void familyParentsAreAbstract() {
        assertThat(SchemaLoadException.class).isAbstract();
        assertThat(ArgumentValidationException.class).isAbstract();
        assertThat(ResponseNormalizationException.class).isAbstract();
        assertThat(TransportException.class).isAbstract();
        assertThat(SchemaLoadException.class.getSuperclass()).isEqualTo(UcmSdkException.class);
        assertThat(ArgumentValidationException.class.getSuperclass()).isEqualTo(UcmSdkException.class);
        assertThat(ResponseNormalizationException.class.getSuperclass()).isEqualTo(UcmSdkException.class);
        assertThat(TransportException.class.getSuperclass()).isEqualTo(UcmSdkException.class);
    }

    // --- Load-time exceptions ---

    @Test
    void schemaParseExceptionCarriesSource() {
        var cause = new IllegalStateException("bad yaml");
        var ex = new SchemaParseException("cannot parse", cause, "14.0", "/schemas/14.0/axl.yaml");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.apiVersion()).isEqualTo("14.0");
        assertThat(ex.operation()).isNull();
        assertThat(ex.source()).isEqualTo("/schemas/14.0/axl.yaml");
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.LOAD);
        assertThat(ex.detail()).isEqualTo("cannot parse");
    }

    @Test
    void unknownOperationExceptionCarriesOperationAndVersion() {
        var ex = new UnknownOperationException("unknown", "getPhnoe", "14.0");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.operation()).isEqualTo("getPhnoe");
        assertThat(ex.apiVersion()).isEqualTo("14.0");
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.LOAD);
    }

    @Test
    void unsupportedVersionExceptionIsLoadPhase() {
        var ex = new UnsupportedVersionException("no schema", "9.1");

        assertThat(ex).isInstanceOf(SchemaLoadException.class);
        assertThat(ex.apiVersion()).isEqualTo("9.1");
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.LOAD);
    }

    // --- Validation exceptions ---

    @Test
    void validationExceptionsCarryFieldPath() {
        List<ArgumentValidationException> all = List.of(
                new UnexpectedFieldException("m", "addPhone", "14.0", "phone.colour"),
                new MissingFieldException("m", "addPhone", "14.0", "phone.lines[0].directoryNumber"),
                new TypeMismatchException("m", "addPhone", "14.0", "phone.model", List.of("7841", "8865")),
                new ChoiceViolationException("m", "getPhone", "14.0", "uuid", List.of("name", "uuid")),
                new ReturnTagNotValidException("m", "getPhone", "14.0", "returnedTags.colour", List.of("name")));

        assertThat(all).allSatisfy(ex -> {
            assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.VALIDATION);
            assertThat(ex.fieldPath()).isNotBlank();
            assertThat(ex.apiVersion()).isEqualTo("14.0");
        });
    }

    @Test
    void typeMismatchWithoutAllowedValuesHasEmptyList() {
        var ex = new TypeMismatchException("m", "addPhone", "14.0", "phone.name");

        assertThat(ex.allowedValues()).isEmpty();
    }

    @Test
    void typeMismatchAllowedValuesAreImmutable() {
        var ex = new TypeMismatchException("m", "addPhone", "14.0", "phone.model", List.of("7841", "8865"));

        assertThat(ex.allowedValues()).containsExactly("7841", "8865");
        assertThat(ex.allowedValues()).isUnmodifiable();
    }

    // --- Response exceptions ---

    @Test
    void unknownEnumValueExceptionCarriesValue() {
        var ex = new UnknownEnumValueException("m", "getPhone", "14.0", "return.phone.model", "9999", List.of("7841"));

        assertThat(ex).isInstanceOf(ResponseNormalizationException.class);
        assertThat(ex.value()).isEqualTo("9999");
        assertThat(ex.allowedValues()).containsExactly("7841");
        assertThat(ex.fieldPath()).isEqualTo("return.phone.model");
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.RESPONSE);
    }

    @Test
    void responseShapeExceptionKeepsCause() {
        var cause = new IllegalArgumentException("not a number");
        var ex = new ResponseShapeException("m", cause, "getPhone", "14.0", "return.phone.lines[0].index");

        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.RESPONSE);
    }

    // --- Transport exceptions ---

    @Test
    void remoteFaultExceptionCarriesFaultFields() {
        var ex = new RemoteFaultException("soapenv:Server", "Item not valid", "<axlcode>5007</axlcode>");

        assertThat(ex.faultCode()).isEqualTo("soapenv:Server");
        assertThat(ex.faultString()).isEqualTo("Item not valid");
        assertThat(ex.faultDetail()).isEqualTo("<axlcode>5007</axlcode>");
        assertThat(ex.phase()).isEqualTo(UcmSdkException.Phase.TRANSPORT);
        assertThat(ex.operation()).isNull();
    }

    @Test
    void withContextKeepsTypeAndAttachesCallContext() {
        var original = new RemoteFaultException("soapenv:Server", "Item not valid", null);

        RemoteFaultException contextual = original.withContext("getPhone", "14.0");

        assertThat(contextual.operation()).isEqualTo("getPhone");
        assertThat(contextual.apiVersion()).isEqualTo("14.0");
        assertThat(contextual.getMessage()).isEqualTo("getPhone (v14.0): Item not valid");
        assertThat(contextual.faultCode()).isEqualTo("soapenv:Server");
        assertThat(contextual.getCause()).isSameAs(original);
    }

    @Test
    void withContextDoesNotRepeatPrefix() {
        var once = new ConnectionFailureException("refused", "cucm.example.com").withContext("getPhone", "14.0");

        ConnectionFailureException twice = once.withContext("getPhone", "14.0");

        assertThat(twice.getMessage()).isEqualTo("getPhone (v14.0): refused");
        assertThat(twice.server()).isEqualTo("cucm.example.com");
    }

    @Test
    void authenticationExceptionKeepsUsername() {
        var ex = new AuthenticationException("401 Unauthorized", "cucm.example.com", "axladmin")
                .withContext("getPhone", "14.0");

        assertThat(ex.username()).isEqualTo("axladmin");
        assertThat(ex.server()).isEqualTo("cucm.example.com");
        assertThat(ex).isInstanceOf(TransportException.class);
    }
}
