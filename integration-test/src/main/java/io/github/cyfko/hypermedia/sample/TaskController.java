package io.github.cyfko.hypermedia.sample;

import io.github.cyfko.hypermedia.core.DocumentBuilder;
import io.github.cyfko.hypermedia.core.Hypermedia;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.ErrorInfo;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Template;
import io.github.cyfko.hypermedia.core.resolution.ResolvedTransition;
import io.github.cyfko.hypermedia.core.resolution.TransitionRef;
import io.github.cyfko.hypermedia.spring.support.HandlerMethodIdentities;
import io.github.cyfko.hypermedia.spring.web.SpringRepresentor;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Task endpoints answering with Collection+JSON or HTML depending on the {@code Accept} header.
 */
@RestController
public class TaskController {

    private static final TransitionRef HOME =
            TransitionRef.handle(HandlerMethodIdentities.method(TaskController.class, "home"));

    private final Hypermedia hypermedia;
    private final SpringRepresentor representor;
    private final TaskRepository repository;

    public TaskController(Hypermedia hypermedia, SpringRepresentor representor, TaskRepository repository) {
        this.hypermedia = hypermedia;
        this.representor = representor;
        this.repository = repository;
    }

    @GetMapping("/")
    @Operation(operationId = "home")
    public ResponseEntity<Object> home() {
        return representor.respond(hypermedia.document("Task Tracker")
                .link(HOME)
                .link("list_tasks")
                .query("search_tasks")
                .build());
    }

    @GetMapping("/tasks")
    @Operation(operationId = "list_tasks")
    public ResponseEntity<Object> listTasks() {
        return representor.respond(collection("Tasks", repository.findAll()));
    }

    @GetMapping("/tasks/search")
    @Operation(operationId = "search_tasks")
    public ResponseEntity<Object> searchTasks(@RequestParam(name = "q", required = false) String q) {
        return representor.respond(collection("Search Results", repository.search(q)));
    }

    @GetMapping("/tasks/{task_id}")
    @Operation(operationId = "view_task")
    public ResponseEntity<Object> viewTask(@PathVariable("task_id") long taskId) {
        return repository.findById(taskId)
                .map(task -> representor.respond(single("Task", task)))
                .orElseGet(() -> notFound(taskId));
    }

    @PostMapping("/tasks")
    @Operation(operationId = "create_task")
    public ResponseEntity<Object> createTask(@RequestBody TaskInput input) {
        Task task = repository.create(input);
        return representor.respond(single("Task Created", task), HttpStatus.CREATED);
    }

    @PutMapping("/tasks/{task_id}")
    @Operation(operationId = "update_task")
    public ResponseEntity<Object> updateTask(@PathVariable("task_id") long taskId, @RequestBody TaskInput input) {
        return repository.update(taskId, input)
                .map(task -> representor.respond(single("Task Updated", task)))
                .orElseGet(() -> notFound(taskId));
    }

    private CollectionDocument collection(String title, List<Task> tasks) {
        DocumentBuilder document = hypermedia.document(title)
                .link("list_tasks", "collection")
                .link(HOME)
                .query("search_tasks", "search")
                .template("create_task");
        for (Task task : tasks) {
            document.item(item(task));
        }
        return document.build();
    }

    private CollectionDocument single(String title, Task task) {
        return hypermedia.document(title)
                .item(item(task))
                .link("list_tasks", "collection")
                .template(editTemplate(task))
                .build();
    }

    private Item item(Task task) {
        Map<String, Object> params = Map.of("task_id", task.id());
        List<Link> links = hypermedia.resolver().resolve("update_task", params)
                .map(t -> List.of(t.toLink("edit")))
                .orElse(List.of());
        String href = hypermedia.resolver().resolve("view_task", params)
                .map(ResolvedTransition::href)
                .orElse("");
        return hypermedia.item(task, href, links);
    }

    private Template editTemplate(Task task) {
        Map<String, Object> defaults = new HashMap<>();
        defaults.put("title", task.title());
        defaults.put("notes", task.notes());
        defaults.put("priority", task.priority());
        defaults.put("done", task.done());
        return hypermedia.resolver().resolve("update_task", Map.of("task_id", task.id()))
                .map(t -> t.toTemplate(defaults))
                .orElseThrow(() -> new IllegalStateException("update_task is not described"));
    }

    private ResponseEntity<Object> notFound(long taskId) {
        CollectionDocument document = hypermedia.document("Task")
                .link("list_tasks", "collection")
                .error(new ErrorInfo("Not Found", 404, "No task with id " + taskId))
                .build();
        return representor.respond(document);
    }
}
