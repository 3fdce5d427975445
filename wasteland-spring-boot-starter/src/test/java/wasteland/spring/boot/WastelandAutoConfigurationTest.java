package wasteland.spring.boot;

import wasteland.CapabilityUnavailableException;
import wasteland.Mode;
import wasteland.PostInput;
import wasteland.WastelandClient;
import wasteland.Workspace;
import wasteland.jdbc.ConnectionProvider;
import wasteland.jdbc.DataSourceConnectionProvider;
import wasteland.jdbc.store.DoltCommonsStore;
import wasteland.jdbc.store.H2CommonsStore;
import wasteland.model.BrowseFilter;
import wasteland.spi.CommonsStore;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WastelandAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          WastelandAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "wasteland.rig-handle=alice");

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("commonsStore"));
      assertTrue(ctx.containsBean("wastelandClient"));
      assertTrue(ctx.containsBean("workspace"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2CommonsStore.class, ctx.getBean(CommonsStore.class));
      WastelandClient client = ctx.getBean(WastelandClient.class);
      assertEquals("alice", client.rigHandle());
      assertEquals(Mode.WILD_WEST, client.mode());
      assertFalse(client.signing());
      assertTrue(ctx.getBean(Workspace.class).upstreams().isEmpty());
    });
  }

  @Test
  void clientWorksAgainstDetectedStore() {
    runner.run(ctx -> {
      WastelandClient client = ctx.getBean(WastelandClient.class);

      String id = client.post(PostInput.builder("Fix bug").build()).detail().item().id();

      assertEquals(id, client.browse(BrowseFilter.all()).items().get(0).id());
    });
  }

  @Test
  void prModeAndSigningFromProperties() {
    runner
        .withPropertyValues("wasteland.mode=pr", "wasteland.signing=true")
        .run(ctx -> {
          WastelandClient client = ctx.getBean(WastelandClient.class);
          assertEquals(Mode.PR, client.mode());
          assertTrue(client.signing());
        });
  }

  @Test
  void registersConfiguredUpstreamInWorkspace() {
    runner
        .withPropertyValues(
            "wasteland.upstream.name=hop/wl-commons",
            "wasteland.upstream.fork-org=alice-org",
            "wasteland.upstream.fork-db=wl-commons")
        .run(ctx -> {
          Workspace workspace = ctx.getBean(Workspace.class);
          assertEquals(1, workspace.upstreams().size());
          assertEquals("alice-org", workspace.upstreams().get(0).forkOrg());
          assertSame(ctx.getBean(WastelandClient.class), workspace.client("hop/wl-commons"));
        });
  }

  @Test
  void wildWestDisabledOnStore() {
    runner
        .withPropertyValues("wasteland.store.wild-west=false")
        .run(ctx -> {
          WastelandClient client = ctx.getBean(WastelandClient.class);
          assertThrows(CapabilityUnavailableException.class,
              () -> client.post(PostInput.builder("Fix bug").build()));
        });
  }

  @Test
  void explicitStoreTypeOverridesDetection() {
    runner
        .withPropertyValues("wasteland.store.type=dolt", "wasteland.store.origin-remote=fork")
        .run(ctx -> assertInstanceOf(DoltCommonsStore.class, ctx.getBean(CommonsStore.class)));
  }

  @Test
  void missingRigHandleFailsStartup() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            WastelandAutoConfiguration.class))
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver")
        .run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(WastelandAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("wastelandClient"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
      assertEquals("my_custom_store", ctx.getBeanNamesForType(CommonsStore.class)[0]);
      assertFalse(ctx.containsBean("commonsStore"));
    });
  }

  @Test
  void metricsExporterIsWiredIntoClient() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(
            DataSourceAutoConfiguration.class,
            WastelandMicrometerAutoConfiguration.class,
            WastelandAutoConfiguration.class))
        .withUserConfiguration(MeterRegistryConfig.class)
        .withPropertyValues(
            "spring.datasource.url=jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1",
            "spring.datasource.driver-class-name=org.h2.Driver",
            "wasteland.rig-handle=alice")
        .run(ctx -> {
          ctx.getBean(WastelandClient.class).post(PostInput.builder("Counted").build());

          MeterRegistry registry = ctx.getBean(MeterRegistry.class);
          assertEquals(1.0, registry.get("wasteland.mutation").tag("transition", "post")
              .tag("mode", "wild-west").counter().count());
        });
  }

  // ── Test configurations ──────────────────────────────────────

  @Configuration
  static class CustomStoreConfig {
    @Bean("my_custom_store")
    CommonsStore commonsStore(ConnectionProvider connectionProvider) {
      return new H2CommonsStore(connectionProvider).initialize();
    }
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
