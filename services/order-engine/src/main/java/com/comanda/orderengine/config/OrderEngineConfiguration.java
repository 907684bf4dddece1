package com.comanda.orderengine.config;

import com.comanda.eventmodel.AggregateType;
import com.comanda.eventstore.EventStore;
import com.comanda.eventstore.InMemoryEventStore;
import com.comanda.eventstore.snapshot.InMemorySnapshotStore;
import com.comanda.eventstore.snapshot.SnapshotStore;
import com.comanda.observability.HealthCheckRegistry;
import com.comanda.observability.MetricFactory;
import com.comanda.observability.SensitiveDataRedactor;
import com.comanda.observability.SpanHelper;
import com.comanda.orderengine.application.CatalogGateway;
import com.comanda.orderengine.application.CommandInstrumentation;
import com.comanda.orderengine.application.OrderCommandService;
import com.comanda.orderengine.application.OrderRepository;
import com.comanda.orderengine.application.SessionCommandService;
import com.comanda.orderengine.application.SessionRepository;
import com.comanda.orderengine.application.SessionToOrderConverter;
import com.comanda.orderengine.collaborator.ActorResolver;
import com.comanda.orderengine.collaborator.CommandMetadataProvider;
import com.comanda.orderengine.collaborator.ConfiguredTaxRateProvider;
import com.comanda.orderengine.collaborator.ContextActorResolver;
import com.comanda.orderengine.collaborator.InMemoryInventoryService;
import com.comanda.orderengine.collaborator.InMemoryItemCatalog;
import com.comanda.orderengine.collaborator.InventoryService;
import com.comanda.orderengine.collaborator.ItemCatalog;
import com.comanda.orderengine.collaborator.NoPromotionEngine;
import com.comanda.orderengine.collaborator.OrderNumberGenerator;
import com.comanda.orderengine.collaborator.PromotionEngine;
import com.comanda.orderengine.collaborator.RandomOrderNumberGenerator;
import com.comanda.orderengine.collaborator.TaxRateProvider;
import com.comanda.orderengine.domain.order.OrderEvolver;
import com.comanda.orderengine.domain.order.OrderState;
import com.comanda.orderengine.domain.session.SessionEvolver;
import com.comanda.orderengine.domain.session.SessionState;
import com.comanda.orderengine.health.EventStoreHealthCheck;
import com.comanda.orderengine.health.ProjectionHealthCheck;
import com.comanda.orderengine.introspection.EventStreamIntrospector;
import com.comanda.orderengine.projection.OrderReadModel;
import com.comanda.orderengine.projection.ProjectionDispatcher;
import com.comanda.orderengine.projection.ProjectionStore;
import com.comanda.orderengine.projection.Projector;
import com.comanda.orderengine.projection.QueuedProjectionDispatcher;
import com.comanda.orderengine.projection.SessionReadModel;
import com.comanda.orderengine.projection.SynchronousProjectionDispatcher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.OpenTelemetry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine: in-memory stores, repositories, projections, command services and health.
 *
 * <p>Collaborators, the meter registry and OpenTelemetry are only defaults; any bean of the same
 * type defined elsewhere replaces them.
 */
@Configuration
public class OrderEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OrderEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, OrderEngineProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper(OpenTelemetry openTelemetry, OrderEngineProperties properties) {
        return new SpanHelper(openTelemetry.getTracer(properties.name()));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }

    @Bean
    public EventStore eventStore(Clock clock) {
        return new InMemoryEventStore(clock);
    }

    @Bean
    public SnapshotStore snapshotStore() {
        return new InMemorySnapshotStore();
    }

    // --- collaborators ---

    @Bean
    @ConditionalOnMissingBean
    public ItemCatalog itemCatalog() {
        return new InMemoryItemCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public InventoryService inventoryService() {
        return new InMemoryInventoryService();
    }

    @Bean
    @ConditionalOnMissingBean
    public PromotionEngine promotionEngine() {
        return new NoPromotionEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaxRateProvider taxRateProvider(OrderEngineProperties properties) {
        return new ConfiguredTaxRateProvider(properties.taxRate(), properties.locationTaxRates());
    }

    @Bean
    @ConditionalOnMissingBean
    public ActorResolver actorResolver() {
        return new ContextActorResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public OrderNumberGenerator orderNumberGenerator(Clock clock) {
        return new RandomOrderNumberGenerator(clock);
    }

    @Bean
    public CommandMetadataProvider commandMetadataProvider(
            Clock clock, ActorResolver actors, OrderEngineProperties properties) {
        return new CommandMetadataProvider(clock, actors, properties.name());
    }

    // --- repositories ---

    @Bean
    public OrderRepository orderRepository(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            CommandMetadataProvider metadata,
            OrderEngineProperties properties,
            Clock clock) {
        return new OrderRepository(eventStore, snapshotStore, metadata, properties.snapshotInterval(), clock);
    }

    @Bean
    public SessionRepository sessionRepository(
            EventStore eventStore,
            SnapshotStore snapshotStore,
            CommandMetadataProvider metadata,
            OrderEngineProperties properties,
            Clock clock) {
        return new SessionRepository(eventStore, snapshotStore, metadata, properties.snapshotInterval(), clock);
    }

    // --- projections ---

    @Bean
    public ProjectionStore<OrderState> orderRows() {
        return new ProjectionStore<>();
    }

    @Bean
    public ProjectionStore<SessionState> sessionRows() {
        return new ProjectionStore<>();
    }

    @Bean
    public Projector<OrderState> orderProjector(EventStore eventStore, ProjectionStore<OrderState> orderRows) {
        return new Projector<>(AggregateType.ORDER, OrderEvolver.INSTANCE, eventStore, orderRows);
    }

    @Bean
    public Projector<SessionState> sessionProjector(
            EventStore eventStore, ProjectionStore<SessionState> sessionRows) {
        return new Projector<>(AggregateType.ORDER_SESSION, SessionEvolver.INSTANCE, eventStore, sessionRows);
    }

    @Bean(destroyMethod = "close")
    public ProjectionDispatcher projectionDispatcher(
            EventStore eventStore,
            Projector<OrderState> orderProjector,
            Projector<SessionState> sessionProjector,
            MetricFactory metrics,
            OrderEngineProperties properties) {
        SynchronousProjectionDispatcher synchronous =
                new SynchronousProjectionDispatcher(List.of(orderProjector, sessionProjector), metrics);
        ProjectionDispatcher dispatcher =
                properties.projectionMode() == ProjectionMode.QUEUED
                        ? new QueuedProjectionDispatcher(synchronous)
                        : synchronous;
        eventStore.subscribe(dispatcher);
        metrics.gauge(
                "order_engine.projection.backlog", "Events waiting to be projected", dispatcher::backlog);
        log.info("Projections dispatched in {} mode", properties.projectionMode());
        return dispatcher;
    }

    @Bean
    public OrderReadModel orderReadModel(ProjectionStore<OrderState> orderRows) {
        return new OrderReadModel(orderRows);
    }

    @Bean
    public SessionReadModel sessionReadModel(ProjectionStore<SessionState> sessionRows) {
        return new SessionReadModel(sessionRows);
    }

    // --- application ---

    @Bean
    public CatalogGateway catalogGateway(ItemCatalog catalog, InventoryService inventory) {
        return new CatalogGateway(catalog, inventory);
    }

    @Bean
    public CommandInstrumentation commandInstrumentation(MetricFactory metrics, SpanHelper spans) {
        return new CommandInstrumentation(metrics, spans);
    }

    @Bean
    public OrderCommandService orderCommandService(
            OrderRepository orders,
            OrderReadModel readModel,
            CatalogGateway catalog,
            PromotionEngine promotions,
            TaxRateProvider taxRates,
            OrderNumberGenerator orderNumbers,
            ActorResolver actors,
            SensitiveDataRedactor redactor,
            CommandInstrumentation instrumentation,
            OrderEngineProperties properties) {
        return new OrderCommandService(
                orders,
                readModel,
                catalog,
                promotions,
                taxRates,
                orderNumbers,
                actors,
                redactor,
                instrumentation,
                properties.currency());
    }

    @Bean
    public SessionToOrderConverter sessionToOrderConverter(
            SessionRepository sessions,
            OrderRepository orders,
            CatalogGateway catalog,
            OrderNumberGenerator orderNumbers,
            ActorResolver actors,
            OrderEngineProperties properties) {
        return new SessionToOrderConverter(
                sessions,
                orders,
                catalog,
                orderNumbers,
                actors,
                properties.missingItemPolicy(),
                properties.currency());
    }

    @Bean
    public SessionCommandService sessionCommandService(
            SessionRepository sessions,
            SessionReadModel readModel,
            SessionToOrderConverter converter,
            CommandInstrumentation instrumentation) {
        return new SessionCommandService(sessions, readModel, converter, instrumentation);
    }

    @Bean
    public EventStreamIntrospector eventStreamIntrospector(EventStore eventStore, SnapshotStore snapshotStore) {
        return new EventStreamIntrospector(eventStore, snapshotStore);
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(
            EventStore eventStore,
            ProjectionDispatcher dispatcher,
            ProjectionStore<OrderState> orderRows,
            ProjectionStore<SessionState> sessionRows,
            OrderEngineProperties properties,
            Clock clock) {
        HealthCheckRegistry registry = new HealthCheckRegistry(HealthCheckRegistry.DEFAULT_TIMEOUT_MS, clock);
        registry.register("event-store", new EventStoreHealthCheck(eventStore));
        registry.register(
                "projections",
                new ProjectionHealthCheck(
                        dispatcher, List.of(orderRows, sessionRows), properties.maxProjectionBacklog()));
        return registry;
    }
}
