package com.endpointdoc.core.operation;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.config.NamingConvention;
import com.endpointdoc.core.config.SpecDialect;
import com.endpointdoc.core.model.EndpointDefinition;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.EndpointSummary;
import com.endpointdoc.core.model.FieldBinding;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.ResponseHeader;
import com.endpointdoc.core.model.ResponseTypeMetadata;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.model.WireType;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import io.swagger.v3.oas.models.responses.ApiResponses;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ResponseAssembler}.
 */
class ResponseAssemblerTest extends OperationTestBase {

    private static final TypeShape ORDER = TypeShape.of("Order",
        FieldShape.of("Id", WireType.integer()),
        FieldShape.of("Total", WireType.number()));

    private ApiResponses assemble(EndpointSummary summary, ResponseTypeMetadata... responses) {
        EndpointDescriptor descriptor = EndpointDescriptor.builder("GET", "/orders")
            .responses(responses)
            .definition(EndpointDefinition.of("GetOrders").withSummary(summary))
            .build();
        OperationDescription operation = seed(descriptor);
        new ResponseAssembler(registry, generator, sampler, options, mapper).assemble(operation, descriptor);
        return operation.getOperation().getResponses();
    }

    @Test
    void assemble_noDescriptions_appliesDefaultReasonPhrases() {
        ApiResponses responses = assemble(null,
            ResponseTypeMetadata.of(200, ORDER),
            ResponseTypeMetadata.empty(404),
            ResponseTypeMetadata.empty(418));

        assertThat(responses.get("200").getDescription()).isEqualTo("Success");
        assertThat(responses.get("404").getDescription()).isEqualTo("Not Found");
        assertThat(responses.get("404").getContent()).isNull();
        assertThat(responses.get("418").getDescription()).isNull();
    }

    @Test
    void assemble_userResponseDescription_overridesDefault() {
        ApiResponses responses = assemble(EndpointSummary.of("List", null).withResponses(Map.of(200, "All orders")),
            ResponseTypeMetadata.of(200, ORDER));

        assertThat(responses.get("200").getDescription()).isEqualTo("All orders");
    }

    @Test
    void assemble_duplicateStatus_lastDeclarationWins() {
        TypeShape invoice = TypeShape.of("Invoice", FieldShape.of("Number", WireType.string()));

        ApiResponses responses = assemble(null,
            ResponseTypeMetadata.of(200, ORDER).withExample(Map.of("id", 1)),
            ResponseTypeMetadata.of(200, invoice).withExample(Map.of("number", "INV-1")));

        Content content = responses.get("200").getContent();
        assertThat(content.get("application/json").getSchema().get$ref()).isEqualTo("#/components/schemas/Invoice");
        assertThat(content.get("application/json").getExample()).isEqualTo(Map.of("number", "INV-1"));
    }

    @Test
    void assemble_severalContentTypes_shareOneSchema() {
        ApiResponses responses = assemble(null,
            ResponseTypeMetadata.of(200, ORDER).withContentTypes("application/json", "application/xml", "text/csv"));

        Content content = responses.get("200").getContent();
        assertThat(content).containsOnlyKeys("application/json", "application/xml", "text/csv");
        assertThat(content.get("application/xml")).isSameAs(content.get("application/json"));
        assertThat(content.get("text/csv").getSchema().get$ref()).isEqualTo("#/components/schemas/Order");
    }

    @Test
    void assemble_example_metadataWinsOverSummary() {
        EndpointSummary summary = EndpointSummary.of(null, null)
            .withResponseExamples(Map.of(200, Map.of("id", 2), 201, Map.of("id", 3)));

        ApiResponses responses = assemble(summary,
            ResponseTypeMetadata.of(200, ORDER).withExample(Map.of("id", 1)),
            ResponseTypeMetadata.of(201, ORDER));

        assertThat(responses.get("200").getContent().get("application/json").getExample()).isEqualTo(Map.of("id", 1));
        assertThat(responses.get("201").getContent().get("application/json").getExample()).isEqualTo(Map.of("id", 3));
    }

    @Test
    void assemble_exposeAsHeaderField_addsResponseHeader() {
        TypeShape page = TypeShape.of("OrderPage",
            FieldShape.of("TotalCount", WireType.integer())
                .withBinding(FieldBinding.toHeader("X-Total-Count"))
                .withDescription("Total number of orders")
                .withExample(42),
            FieldShape.of("NextCursor", WireType.string()).withBinding(FieldBinding.toHeader(null)),
            FieldShape.of("Items", WireType.arrayOf(WireType.object(ORDER))));

        ApiResponses responses = assemble(null, ResponseTypeMetadata.of(200, page));

        Map<String, Header> headers = responses.get("200").getHeaders();
        assertThat(headers).containsOnlyKeys("X-Total-Count", "nextCursor");
        Header total = headers.get("X-Total-Count");
        assertThat(total.getSchema().getType()).isEqualTo("integer");
        assertThat(total.getExample()).isEqualTo(42);
        assertThat(total.getDescription()).isEqualTo("Total number of orders");
        assertThat(headers.get("nextCursor").getExample()).isEqualTo("string");
    }

    @Test
    void assemble_userHeader_overridesSynthesizedHeader() {
        TypeShape page = TypeShape.of("OrderPage",
            FieldShape.of("TotalCount", WireType.integer()).withBinding(FieldBinding.toHeader("X-Total-Count")));
        EndpointSummary summary = EndpointSummary.of(null, null).withResponseHeaders(List.of(
            new ResponseHeader(200, "X-Total-Count", "Rows matching the filter", 100),
            new ResponseHeader(200, "X-Request-Id", "Correlation id", "abc-123"),
            new ResponseHeader(404, "X-Ignored", null, null)));

        ApiResponses responses = assemble(summary,
            ResponseTypeMetadata.of(200, page),
            ResponseTypeMetadata.empty(404));

        Header total = responses.get("200").getHeaders().get("X-Total-Count");
        assertThat(total.getDescription()).isEqualTo("Rows matching the filter");
        assertThat(total.getExample()).isEqualTo(100);
        assertThat(total.getSchema().getType()).isEqualTo("integer");
        assertThat(responses.get("200").getHeaders().get("X-Request-Id").getSchema().getType()).isEqualTo("string");
        assertThat(responses.get("404").getHeaders()).containsOnlyKeys("X-Ignored");
    }

    @Test
    void assemble_polymorphicResponse_isFlattenedIntoOneOf() {
        useOptions(DocumentOptions.builder().useOneOfForPolymorphism(true).build());
        TypeShape cat = TypeShape.of("Cat", FieldShape.of("Lives", WireType.integer()));
        TypeShape dog = TypeShape.of("Dog", FieldShape.of("Breed", WireType.string()));
        TypeShape pet = TypeShape.of("Pet", FieldShape.of("Kind", WireType.string())).withSubTypes("kind", cat, dog);

        ApiResponses responses = assemble(null, ResponseTypeMetadata.of(200, pet).withContentTypes("application/json", "application/xml"));

        Schema<?> schema = responses.get("200").getContent().get("application/json").getSchema();
        assertThat(schema.get$ref()).isNull();
        assertThat(schema.getOneOf()).extracting(Schema::get$ref)
            .containsExactly("#/components/schemas/Cat", "#/components/schemas/Dog");
        assertThat(responses.get("200").getContent().get("application/xml").getSchema()).isSameAs(schema);
    }

    @Test
    void assemble_polymorphismFlatteningDisabled_keepsReference() {
        TypeShape cat = TypeShape.of("Cat", FieldShape.of("Lives", WireType.integer()));
        TypeShape pet = TypeShape.of("Pet", FieldShape.of("Kind", WireType.string())).withSubTypes("kind", cat);

        ApiResponses responses = assemble(null, ResponseTypeMetadata.of(200, pet));

        assertThat(responses.get("200").getContent().get("application/json").getSchema().get$ref())
            .isEqualTo("#/components/schemas/Pet");
    }

    @Test
    void assemble_byteArrayResponse_isReportedAsBinary() {
        ApiResponses responses = assemble(null,
            ResponseTypeMetadata.ofValue(200, WireType.bytes()).withContentTypes("application/octet-stream"));

        Schema<?> schema = responses.get("200").getContent().get("application/octet-stream").getSchema();
        assertThat(schema.getType()).isEqualTo("string");
        assertThat(schema.getFormat()).isEqualTo("binary");
    }

    @Test
    void assemble_responsePropertyDescriptions_resolveThroughNaming() {
        useOptions(DocumentOptions.builder().namingConvention(NamingConvention.SNAKE_CASE).build());
        TypeShape stats = TypeShape.of("Stats",
            FieldShape.of("TotalCount", WireType.integer()),
            FieldShape.of("AveragePrice", WireType.number()));
        EndpointSummary summary = EndpointSummary.of(null, null).withResponseParams(Map.of(200, Map.of(
            "TotalCount", "Number of orders",
            "average_price", "Mean price")));

        assemble(summary, ResponseTypeMetadata.of(200, stats));

        Map<String, Schema> properties = registry.get("Stats").getProperties();
        assertThat(properties.get("total_count").getDescription()).isEqualTo("Number of orders");
        assertThat(properties.get("average_price").getDescription()).isEqualTo("Mean price");
    }

    @Test
    void assemble_legacyDialect_serializesArrayExamplesAsText() {
        useOptions(DocumentOptions.builder().dialect(SpecDialect.SWAGGER_2).build());

        ApiResponses responses = assemble(null,
            ResponseTypeMetadata.of(200, TypeShape.listOf("OrderList", ORDER)).withExample(List.of(1, 2)));

        assertThat(responses.get("200").getContent().get("application/json").getExample()).isEqualTo("[1,2]");
    }

    @Test
    void assemble_presetDescription_isKept() {
        EndpointDescriptor descriptor = EndpointDescriptor.builder("GET", "/orders")
            .responses(ResponseTypeMetadata.of(200, ORDER))
            .definition(EndpointDefinition.of("GetOrders").withSummary(
                EndpointSummary.of(null, null).withResponses(Map.of(200, "ignored"))))
            .build();
        OperationDescription operation = seed(descriptor);
        ApiResponse response = operation.getOperation().getResponses().get("200");
        response.setDescription("Provided by the host");

        new ResponseAssembler(registry, generator, sampler, options, mapper).assemble(operation, descriptor);

        assertThat(response.getDescription()).isEqualTo("Provided by the host");
    }
}
