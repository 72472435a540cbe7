package maestro.coordinator.config;

import maestro.coordinator.api.v1.HealthController;
import maestro.coordinator.api.v1.OrderingController;
import maestro.coordinator.api.v1.ProjectController;
import maestro.coordinator.api.v1.QueueController;
import maestro.coordinator.api.v1.SessionController;
import maestro.coordinator.api.v1.TaskController;
import maestro.coordinator.api.v1.TaskListController;
import maestro.coordinator.core.EventBus;
import maestro.coordinator.core.KeyedLocks;
import maestro.coordinator.core.ObserverBridge;
import maestro.coordinator.repository.OrderingRepository;
import maestro.coordinator.repository.ProjectRepository;
import maestro.coordinator.repository.QueueRepository;
import maestro.coordinator.repository.SessionRepository;
import maestro.coordinator.repository.TaskListRepository;
import maestro.coordinator.repository.TaskRepository;
import maestro.coordinator.server.RouterHandler;
import maestro.coordinator.service.OrderingService;
import maestro.coordinator.service.ProjectService;
import maestro.coordinator.service.QueueService;
import maestro.coordinator.service.RelationshipMaintainer;
import maestro.coordinator.service.SessionService;
import maestro.coordinator.service.TaskListService;
import maestro.coordinator.service.TaskService;
import maestro.coordinator.store.Database;
import maestro.coordinator.store.JdbcOrderingRepository;
import maestro.coordinator.store.JdbcProjectRepository;
import maestro.coordinator.store.JdbcQueueRepository;
import maestro.coordinator.store.JdbcSessionRepository;
import maestro.coordinator.store.JdbcTaskListRepository;
import maestro.coordinator.store.JdbcTaskRepository;
import maestro.coordinator.store.RecordStore;
import maestro.coordinator.store.StoreLoader;
import maestro.coordinator.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final RecordStore store;
    private final StoreLoader.HealReport loadReport;

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final SessionRepository sessionRepository;
    private final QueueRepository queueRepository;
    private final TaskListRepository taskListRepository;
    private final OrderingRepository orderingRepository;

    private final KeyedLocks locks;
    private final EventBus eventBus;
    private final IdGenerator idGenerator;
    private final ObserverBridge observerBridge;

    private final RelationshipMaintainer relationships;
    private final ProjectService projectService;
    private final TaskService taskService;
    private final SessionService sessionService;
    private final QueueService queueService;
    private final TaskListService taskListService;
    private final OrderingService orderingService;

    // Controllers
    private final HealthController healthController;
    private final ProjectController projectController;
    private final TaskController taskController;
    private final SessionController sessionController;
    private final QueueController queueController;
    private final TaskListController taskListController;
    private final OrderingController orderingController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.store = new RecordStore(database);
        this.loadReport = new StoreLoader(store).load();

        // Repositories
        this.projectRepository = new JdbcProjectRepository(store);
        this.taskRepository = new JdbcTaskRepository(store);
        this.sessionRepository = new JdbcSessionRepository(store);
        this.queueRepository = new JdbcQueueRepository(store);
        this.taskListRepository = new JdbcTaskListRepository(store);
        this.orderingRepository = new JdbcOrderingRepository(store);

        // Events and concurrency
        this.locks = new KeyedLocks(config.lockStripes());
        this.eventBus = new EventBus(config.eventParallelism());
        this.idGenerator = new IdGenerator();
        this.observerBridge = new ObserverBridge(eventBus);
        observerBridge.start();

        // Services
        this.relationships = new RelationshipMaintainer(store, taskRepository, sessionRepository, locks, eventBus);
        this.projectService = new ProjectService(projectRepository, taskRepository, sessionRepository,
                taskListRepository, orderingRepository, store, locks, eventBus, idGenerator);
        this.taskService = new TaskService(taskRepository, projectRepository, taskListRepository, store,
                relationships, locks, eventBus, idGenerator);
        this.sessionService = new SessionService(sessionRepository, taskRepository, projectRepository,
                queueRepository, store, relationships, locks, eventBus, idGenerator);
        this.queueService = new QueueService(queueRepository, taskRepository, sessionRepository, store,
                relationships, locks, eventBus, idGenerator, config.maxClaimTimeout());
        queueService.registerHandlers();
        this.taskListService = new TaskListService(taskListRepository, projectRepository, taskRepository, locks,
                eventBus, idGenerator);
        this.orderingService = new OrderingService(orderingRepository, projectRepository, locks);

        // Controllers
        this.healthController = new HealthController(database, taskService, sessionService, observerBridge);
        this.projectController = new ProjectController(projectService);
        this.taskController = new TaskController(taskService);
        this.sessionController = new SessionController(sessionService);
        this.queueController = new QueueController(queueService, config.defaultClaimTimeout());
        this.taskListController = new TaskListController(taskListService);
        this.orderingController = new OrderingController(orderingService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public RecordStore store() {
        return store;
    }

    /** What the warm reload found and repaired at startup. */
    public StoreLoader.HealReport loadReport() {
        return loadReport;
    }

    public ProjectRepository projectRepository() {
        return projectRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public SessionRepository sessionRepository() {
        return sessionRepository;
    }

    public QueueRepository queueRepository() {
        return queueRepository;
    }

    public TaskListRepository taskListRepository() {
        return taskListRepository;
    }

    public OrderingRepository orderingRepository() {
        return orderingRepository;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public ObserverBridge observerBridge() {
        return observerBridge;
    }

    public KeyedLocks locks() {
        return locks;
    }

    public RelationshipMaintainer relationships() {
        return relationships;
    }

    public ProjectService projectService() {
        return projectService;
    }

    public TaskService taskService() {
        return taskService;
    }

    public SessionService sessionService() {
        return sessionService;
    }

    public QueueService queueService() {
        return queueService;
    }

    public TaskListService taskListService() {
        return taskListService;
    }

    public OrderingService orderingService() {
        return orderingService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(projectController)
                    .registerController(taskController)
                    .registerController(taskListController)
                    .registerController(orderingController)
                    .registerController(queueController)
                    .registerController(sessionController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            queueService.close();
        } catch (Exception e) {
            log.warn("Error closing queue service: {}", e.getMessage());
        }
        try {
            observerBridge.close();
            eventBus.close();
        } catch (Exception e) {
            log.warn("Error closing event bus: {}", e.getMessage());
        }
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
