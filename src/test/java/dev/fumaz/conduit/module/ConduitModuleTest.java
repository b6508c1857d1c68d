package dev.fumaz.conduit.module;

import dev.fumaz.conduit.container.ConduitContainer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConduitModuleTest {

    static class Settings {
        final String region;

        Settings(String region) {
            this.region = region;
        }
    }

    static class Uploader {
        final Settings settings;

        Uploader(Settings settings) {
            this.settings = settings;
        }
    }

    static class SettingsModule extends ConduitModule {
        @Override
        protected void configure() {
            bind(String.class).toInstance("eu-west");
            bind(Settings.class).asSingleton().toSelf();
        }
    }

    static class UploadModule extends ConduitModule {
        @Override
        protected void configure() {
            install(new SettingsModule());
            bind(Uploader.class).toSelf();
        }
    }

    static class SelfInstallingModule extends ConduitModule {
        @Override
        protected void configure() {
            install(this);
        }
    }

    static class LeakyModule extends ConduitModule {
        @Override
        protected void configure() {
        }

        ConduitContainer leak() {
            return container();
        }
    }

    @Test
    void installsNestedModules() {
        ConduitContainer container = ConduitContainer.create(new UploadModule());

        Uploader uploader = container.get(Uploader.class);

        assertEquals("eu-west", uploader.settings.region);
        assertSame(container.get(Settings.class), uploader.settings);
    }

    @Test
    void moduleCannotInstallItself() {
        ConduitContainer container = new ConduitContainer();

        assertThrows(IllegalArgumentException.class, () -> container.install(new SelfInstallingModule()));
    }

    @Test
    void containerIsOnlyAvailableWhileConfiguring() {
        LeakyModule module = new LeakyModule();
        new ConduitContainer().install(module);

        assertThrows(IllegalStateException.class, module::leak);
    }

    @Test
    void moduleCanBeReused() {
        SettingsModule module = new SettingsModule();
        ConduitContainer first = ConduitContainer.create(module);
        ConduitContainer second = ConduitContainer.create(module);

        assertEquals("eu-west", first.get(Settings.class).region);
        assertEquals("eu-west", second.get(Settings.class).region);
    }
}
