package io.layermesh.layer;

import io.layermesh.error.LifecycleException;
import io.layermesh.error.LookupException;
import io.layermesh.error.ProtocolException;
import io.layermesh.model.ModelClass;
import io.layermesh.util.Stages;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

final class LayerTest {

    @Test
    void generatedNamesAreShortAndFlagged() {
        Layer anonymous = Layer.builder().build();
        Assertions.assertTrue(anonymous.nameWasGenerated());
        Assertions.assertEquals(Layer.GENERATED_NAME_LENGTH, anonymous.getName().length());

        Layer named = Layer.builder().name("backend").build();
        Assertions.assertFalse(named.nameWasGenerated());
        Assertions.assertEquals("backend", named.getName());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Layer.builder().name(" ").build());
    }

    @Test
    void registrationAssignsNameAndOwner() {
        ModelClass movie = new ModelClass();
        Layer layer = Layer.builder().name("backend").register("Movie", movie).build();

        Assertions.assertSame(movie, layer.get("Movie"));
        Assertions.assertEquals("Movie", movie.getRegisteredName());
        Assertions.assertSame(layer, movie.getLayer());
    }

    @Test
    void registrationRejectsDuplicatesOwnedItemsAndOpenLayers() {
        ModelClass movie = new ModelClass();
        Layer layer = Layer.builder().register("Movie", movie).build();

        ProtocolException owned = Assertions.assertThrows(ProtocolException.class,
                () -> Layer.builder().register("Film", movie).build());
        Assertions.assertEquals("Item already registered (name: 'Film')", owned.getMessage());

        ProtocolException duplicate = Assertions.assertThrows(ProtocolException.class,
                () -> layer.register("Movie", new ModelClass()));
        Assertions.assertEquals("Name already registered (name: 'Movie')", duplicate.getMessage());

        await(layer.open());
        ProtocolException open = Assertions.assertThrows(ProtocolException.class,
                () -> layer.register(Map.of("Actor", new ModelClass())));
        Assertions.assertEquals("Cannot register an item in an open layer (name: 'Actor')", open.getMessage());
    }

    @Test
    void lookupHonorsThrowIfNotFound() {
        Layer layer = Layer.builder().build();
        LookupException error = Assertions.assertThrows(LookupException.class, () -> layer.get("Missing"));
        Assertions.assertEquals("Item not found in the layer (name: 'Missing')", error.getMessage());
        Assertions.assertNull(layer.get("Missing", false));
        Assertions.assertEquals(Optional.empty(), layer.find("Missing"));
    }

    @Test
    void typedLookupChecksTheItemType() {
        Layer layer = Layer.builder().register("Movie", new ModelClass()).build();
        Assertions.assertNotNull(layer.get("Movie", ModelClass.class));
        Assertions.assertThrows(LookupException.class, () -> layer.get("Movie", TrackedClass.class));
    }

    @Test
    void openAndCloseVisitEveryItemInOrder() {
        List<String> events = new ArrayList<>();
        Layer layer = Layer.builder()
                .register("First", new TrackedClass("First", events))
                .register("Second", new TrackedClass("Second", events))
                .build();

        await(layer.open());
        Assertions.assertTrue(layer.isOpen());
        await(layer.close());
        Assertions.assertFalse(layer.isOpen());

        Assertions.assertEquals(List.of("open First", "open Second", "close First", "close Second"), events);
    }

    @Test
    void lifecycleIsEnforced() {
        Layer layer = Layer.builder().build();
        LifecycleException notOpen = Assertions.assertThrows(LifecycleException.class, layer::close);
        Assertions.assertEquals("Cannot close a layer that is not open", notOpen.getMessage());

        await(layer.open());
        LifecycleException twice = Assertions.assertThrows(LifecycleException.class, layer::open);
        Assertions.assertEquals("Cannot open a layer that is already open", twice.getMessage());

        Layer fork = layer.fork();
        Assertions.assertTrue(fork.isOpen());
        LifecycleException fromFork = Assertions.assertThrows(LifecycleException.class, fork::close);
        Assertions.assertEquals("Cannot close a layer from a fork", fromFork.getMessage());

        await(layer.close());
        Assertions.assertFalse(fork.isOpen());
    }

    @Test
    void forkOfAClosedLayerManagesItsOwnLifecycle() {
        Layer layer = Layer.builder().build();
        Layer fork = layer.fork();
        await(fork.open());
        Assertions.assertTrue(fork.isOpen());
        Assertions.assertFalse(layer.isOpen());
        await(fork.close());
        Assertions.assertFalse(fork.isOpen());
    }

    @Test
    void parentIsOptionalButRequiredWhenAskedFor() {
        Layer backend = Layer.builder().name("backend").build();
        Layer frontend = Layer.builder().name("frontend").parent(backend).build();
        Layer orphan = Layer.builder().build();

        Assertions.assertSame(backend, frontend.getParent());
        Assertions.assertSame(backend, frontend.fork().getParent());
        Assertions.assertFalse(orphan.hasParent());
        LookupException error = Assertions.assertThrows(LookupException.class, orphan::getParent);
        Assertions.assertEquals("Parent layer not found", error.getMessage());
        Assertions.assertThrows(LookupException.class, () -> orphan.sendQuery(Map.of("Movie=>", true)));
    }

    private static <T> T await(CompletionStage<T> stage) {
        return stage.toCompletableFuture().join();
    }

    private static final class TrackedClass extends ModelClass {
        private final String label;
        private final List<String> events;

        private TrackedClass(String label, List<String> events) {
            this.label = label;
            this.events = events;
        }

        @Override
        public CompletionStage<Void> open() {
            events.add("open " + label);
            return Stages.done();
        }

        @Override
        public CompletionStage<Void> close() {
            events.add("close " + label);
            return Stages.done();
        }
    }
}
