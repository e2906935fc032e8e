package io.ucmsdk.core.testkit;

import io.ucmsdk.core.model.Backend;
import io.ucmsdk.core.model.OperationSchema;
import io.ucmsdk.core.schema.SchemaCatalog;
import io.ucmsdk.core.schema.SchemaSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads the schema fixtures under {@code src/test/resources/schemas}. */
public final class TestSchemas {

    public static final String VERSION = "14.0";

    public static final String AXL_DESCRIPTOR = "schemas/axl/14.0/axl.yaml";
    public static final String RISPORT_DESCRIPTOR = "schemas/risport/14.0/risport.yaml";
    public static final String CUPI_DESCRIPTOR = "schemas/cupi/14.0/cupi.yaml";
    public static final String AXL_WSDL = "schemas/xsd/AXLAPI.wsdl";

    private TestSchemas() {}

    /** Reads a classpath resource as UTF-8 text. */
    public static String resource(String name) {
        try (InputStream in = TestSchemas.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static SchemaSource descriptor(String name) {
        return SchemaSource.descriptor(null, name, resource(name));
    }

    /** A catalog for the backend with its 14.0 descriptor loaded. */
    public static SchemaCatalog catalog(Backend backend) {
        SchemaCatalog catalog = new SchemaCatalog(backend);
        catalog.load(descriptor(descriptorFor(backend)));
        return catalog;
    }

    /** Looks up an AXL 14.0 operation. */
    public static OperationSchema axl(String operation) {
        return AxlHolder.CATALOG.lookup(operation, VERSION);
    }

    private static String descriptorFor(Backend backend) {
        switch (backend) {
            case AXL:
                return AXL_DESCRIPTOR;
            case RISPORT:
                return RISPORT_DESCRIPTOR;
            case CUPI:
                return CUPI_DESCRIPTOR;
            default:
                throw new IllegalArgumentException("No fixture for " + backend);
        }
    }

    private static final class AxlHolder {
        static final SchemaCatalog CATALOG = catalog(Backend.AXL);
    }
}
