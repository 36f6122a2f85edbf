package com.endpointdoc.core.document;

import com.endpointdoc.core.config.DocumentOptions;
import com.endpointdoc.core.model.EndpointDefinition;
import com.endpointdoc.core.model.EndpointDescriptor;
import com.endpointdoc.core.model.EndpointVersion;
import com.endpointdoc.core.model.FieldShape;
import com.endpointdoc.core.model.ResponseTypeMetadata;
import com.endpointdoc.core.model.TypeShape;
import com.endpointdoc.core.model.WireType;
import com.endpointdoc.core.operation.UnsupportedRequestShapeException;
import com.endpointdoc.core.processor.EndpointOperationProcessor;
import com.endpointdoc.core.processor.OperationContext;
import com.endpointdoc.core.processor.OperationProcessor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.PathItem;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentBuilder}.
 */
class DocumentBuilderTest {

    private static final TypeShape ORDER = TypeShape.of("Order",
        FieldShape.of("Id", WireType.integer()),
        FieldShape.of("Note", WireType.string()));

    private static EndpointDescriptor getOrder() {
        return EndpointDescriptor.builder("GET", "api/v1/orders/{id:int}")
            .responses(ResponseTypeMetadata.of(200, ORDER), ResponseTypeMetadata.empty(404))
            .definition(EndpointDefinition.of("GetOrder").withVersion(EndpointVersion.of(1)))
            .build();
    }

    private static EndpointDescriptor updateOrder() {
        return EndpointDescriptor.builder("PUT", "api/v1/orders/{id:int}")
            .request(TypeShape.of("UpdateOrder",
                FieldShape.of("Id", WireType.integer()),
                FieldShape.of("Note", WireType.string())))
            .responses(ResponseTypeMetadata.empty(204))
            .definition(EndpointDefinition.of("UpdateOrder").withVersion(EndpointVersion.of(1)))
            .build();
    }

    @Test
    void build_endpointsOnSamePath_shareOnePathItem() {
        DocumentOptions options = DocumentOptions.builder()
            .title("Orders API")
            .documentVersion("3.0.1")
            .endpointRoutePrefix("api")
            .build();

        BuiltDocument document = new DocumentBuilder(options).build(List.of(getOrder(), updateOrder()));

        OpenAPI openApi = document.openApi();
        assertThat(openApi.getInfo().getTitle()).isEqualTo("Orders API");
        assertThat(openApi.getInfo().getVersion()).isEqualTo("3.0.1");
        assertThat(openApi.getPaths()).containsOnlyKeys("/api/v1/orders/{id}");
        PathItem item = openApi.getPaths().get("/api/v1/orders/{id}");
        assertThat(item.getGet()).isNotNull();
        assertThat(item.getPut()).isNotNull();
        assertThat(document.operationCount()).isEqualTo(2);
        assertThat(openApi.getComponents().getSchemas()).containsKeys("Order", "UpdateOrder");
        assertThat(document.versionMarkers()).extracting(marker -> marker.toTag())
            .containsExactly("|GET:/orders/{id}|1|0|0", "|PUT:/orders/{id}|1|0|0");
    }

    @Test
    void build_noEndpoints_returnsEmptyDocument() {
        BuiltDocument document = new DocumentBuilder(DocumentOptions.defaults()).build(List.of());

        assertThat(document.operationCount()).isZero();
        assertThat(document.versionMarkers()).isEmpty();
        assertThat(document.openApi().getInfo().getTitle()).isEqualTo("API");
    }

    @Test
    void build_processorReturningFalse_excludesOperation() {
        OperationProcessor rejectGets = new RecordingProcessor("reject-gets", 10) {
            @Override
            public boolean process(OperationContext context) {
                super.process(context);
                return !context.descriptor().isGet();
            }
        };

        BuiltDocument document = new DocumentBuilder(DocumentOptions.defaults(),
            List.of(rejectGets, new EndpointOperationProcessor())).build(List.of(getOrder(), updateOrder()));

        assertThat(document.operationCount()).isEqualTo(1);
        PathItem item = document.openApi().getPaths().values().iterator().next();
        assertThat(item.getGet()).isNull();
        assertThat(item.getPut()).isNotNull();
    }

    @Test
    void constructor_sortsProcessorsByOrderThenId() {
        RecordingProcessor late = new RecordingProcessor("late", 200);
        RecordingProcessor beta = new RecordingProcessor("beta", 50);
        RecordingProcessor alpha = new RecordingProcessor("alpha", 50);

        DocumentBuilder builder = new DocumentBuilder(DocumentOptions.defaults(), List.of(late, beta, alpha));

        assertThat(builder.getProcessors()).extracting(OperationProcessor::getId)
            .containsExactly("alpha", "beta", "late");
    }

    @Test
    void build_runsProcessorsInOrderForEveryEndpoint() {
        List<String> calls = new ArrayList<>();
        RecordingProcessor second = new RecordingProcessor("second", 20, calls);
        RecordingProcessor first = new RecordingProcessor("first", 10, calls);

        new DocumentBuilder(DocumentOptions.defaults(), List.of(second, first)).build(List.of(getOrder(), updateOrder()));

        assertThat(calls).containsExactly(
            "first:GET api/v1/orders/{id:int}", "second:GET api/v1/orders/{id:int}",
            "first:PUT api/v1/orders/{id:int}", "second:PUT api/v1/orders/{id:int}");
    }

    @Test
    void build_fatalShape_abortsBuild() {
        EndpointDescriptor broken = EndpointDescriptor.builder("POST", "/jobs")
            .request(TypeShape.of("StartJob", FieldShape.of("Started", WireType.dateTime()).withSettable(false)))
            .definition(EndpointDefinition.of("StartJobEndpoint"))
            .build();
        DocumentBuilder builder = new DocumentBuilder(DocumentOptions.defaults());

        assertThatThrownBy(() -> builder.build(List.of(getOrder(), broken)))
            .isInstanceOf(UnsupportedRequestShapeException.class);
    }

    @Test
    void build_invalidVerb_isRejected() {
        EndpointDescriptor invalid = EndpointDescriptor.builder("FETCH", "/orders").build();
        DocumentBuilder builder = new DocumentBuilder(DocumentOptions.defaults());

        assertThatThrownBy(() -> builder.build(List.of(invalid)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("FETCH");
    }

    /**
     * Processor recording the endpoints it sees.
     */
    private static class RecordingProcessor implements OperationProcessor {

        private final String id;
        private final int order;
        private final List<String> calls;

        RecordingProcessor(String id, int order) {
            this(id, order, new ArrayList<>());
        }

        RecordingProcessor(String id, int order, List<String> calls) {
            this.id = id;
            this.order = order;
            this.calls = calls;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public int getOrder() {
            return order;
        }

        @Override
        public boolean process(OperationContext context) {
            calls.add(id + ":" + context.descriptor().displayName());
            return true;
        }
    }
}
