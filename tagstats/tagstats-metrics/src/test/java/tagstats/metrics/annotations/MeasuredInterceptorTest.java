package tagstats.metrics.annotations;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.ConfigFactory;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tagstats.metrics.MeasuredCallEvents;
import tagstats.metrics.MethodNaming;
import tagstats.metrics.RecordingStatsClient;
import tagstats.metrics.StatsClientModule;
import tagstats.metrics.StatsClientRegistry;

import java.io.IOException;
import java.util.List;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MeasuredInterceptorTest {
  private static final String MODULE = "tagstats.metrics.annotations.MeasuredInterceptorTest.Worker";

  private RecordingStatsClient backend;
  private Injector injector;

  @BeforeEach
  void setUp() {
    backend = new RecordingStatsClient();
    injector = Guice.createInjector(
            new StatsClientModule(ConfigFactory.parseString("tagstats.service = test")),
            new MeasuredAnnotationsModule(),
            new AbstractModule() {
              @Override
              protected void configure() {
                StatsClientModule.clientFactoryBinder(binder()).setBinding().toInstance(options -> backend);
              }
            }
    );
  }

  @Test
  void annotatedMethodsAreMeasured() {
    Worker worker = injector.getInstance(Worker.class);

    assertThat(worker.work(2)).isEqualTo(4);

    assertThat(backend.stats("incr"))
            .containsExactly("incr,module=" + MODULE + ",service=test,def=work,class=MeasuredInterceptorTest.Worker,name=calls");
    assertThat(backend.stats("timing"))
            .containsExactly("timer,module=" + MODULE + ",service=test,def=work,class=MeasuredInterceptorTest.Worker,name=duration");
  }

  @Test
  void unannotatedMethodsAreNotMeasured() {
    injector.getInstance(Worker.class).idle();

    assertThat(backend.emissions()).isEmpty();
  }

  @Test
  void annotationTagsAndNamingApply() {
    injector.getInstance(Worker.class).tagged();

    assertThat(backend.lastStat("incr"))
            .isEqualTo("incr,module=" + MODULE + ",service=test,def=MeasuredInterceptorTest.Worker.tagged,queue=fast,tier=1,name=calls");
  }

  @Test
  void checkedExceptionsPropagateAfterMeasurement() {
    Worker worker = injector.getInstance(Worker.class);

    IOException thrown = assertThrows(IOException.class, worker::fail);

    assertThat(thrown).hasMessageThat().isEqualTo("disk full");
    assertThat(backend.stats("incr")).hasSize(1);
    assertThat(backend.stats("timing")).hasSize(1);
    assertThat(injector.getInstance(StatsClientRegistry.class)
            .getClient("test", Worker.class)
            .tags()).doesNotContainKey("def");
  }

  @Test
  void clientsComeFromTheSharedRegistry() {
    injector.getInstance(Worker.class).work(1);
    injector.getInstance(Worker.class).work(1);

    assertThat(injector.getInstance(StatsClientRegistry.class).size()).isEqualTo(1);
    assertThat(backend.stats("incr")).hasSize(2);
  }

  @Test
  void defaultBackendRecordsIntoMetricRegistry() {
    Injector codahale = Guice.createInjector(
            new StatsClientModule(ConfigFactory.parseString("tagstats.service = test")),
            new MeasuredAnnotationsModule()
    );

    codahale.getInstance(Worker.class).work(3);

    MetricRegistry metrics = codahale.getInstance(MetricRegistry.class);
    assertThat(metrics.counter("incr,module=" + MODULE + ",service=test,def=work,class=MeasuredInterceptorTest.Worker,name=calls").getCount())
            .isEqualTo(1);
    assertThat(metrics.timer("timer,module=" + MODULE + ",service=test,def=work,class=MeasuredInterceptorTest.Worker,name=duration").getCount())
            .isEqualTo(1);
  }

  @Test
  void loggedMethodsLogUnderTheCallersName() {
    Worker worker = injector.getInstance(Worker.class);

    List<LoggingEvent> events = MeasuredCallEvents.capture(() -> worker.audited("order-7"));

    assertThat(events).hasSize(2);
    for (LoggingEvent event : events) {
      assertThat(event.getLoggerName())
              .isEqualTo("tagstats.metrics.annotations.MeasuredInterceptorTest.loggedMethodsLogUnderTheCallersName");
    }
    assertThat(events.get(0).getRenderedMessage()).contains("args=[order-7]");
  }

  public static class Worker {
    @Measured
    public int work(int x) {
      return x * 2;
    }

    public void idle() {
    }

    @Measured(naming = MethodNaming.QualifiedDef)
    @MeasuredTag(key = "queue", value = "fast")
    @MeasuredTag(key = "tier", value = "1")
    public void tagged() {
    }

    @Measured(log = true)
    public void audited(String orderId) {
    }

    @Measured
    public void fail() throws IOException {
      throw new IOException("disk full");
    }
  }
}
