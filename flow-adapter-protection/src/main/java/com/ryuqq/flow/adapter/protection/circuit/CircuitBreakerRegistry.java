package com.ryuqq.flow.adapter.protection.circuit;

import com.ryuqq.flow.core.protection.CircuitBreaker;
import com.ryuqq.flow.core.protection.CircuitBreakerConfig;
import com.ryuqq.flow.core.protection.CircuitMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 이름 단위 Circuit Breaker 레지스트리.
 *
 * <p>프로세스 시작 시 한 번 생성되어 미들웨어에 주입됩니다. 같은 이름으로 요청하면
 * 같은 인스턴스를 반환하며, 새 회로는 기본 설정 템플릿에 이름만 바꿔 생성합니다.</p>
 *
 * <p>작업 실행용 스레드 풀을 소유하므로 종료 시 {@link #close()}를 호출해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CircuitBreakerRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final CircuitBreakerConfig defaults;
    private final Clock clock;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, DefaultCircuitBreaker> circuits = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry() {
        this(new CircuitBreakerConfig("default"), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param defaults 새 회로에 적용할 기본 설정 (이름은 무시됨)
     * @param clock 시계
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig defaults, Clock clock) {
        if (defaults == null) {
            throw new IllegalArgumentException("defaults cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.defaults = defaults;
        this.clock = clock;
        AtomicInteger sequence = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "circuit-breaker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * 이름으로 회로 조회, 없으면 기본 설정으로 생성.
     */
    public CircuitBreaker getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        return circuits.computeIfAbsent(name, n -> create(defaults.withName(n)));
    }

    /**
     * 지정 설정으로 회로 조회 또는 생성.
     *
     * <p>이미 같은 이름의 회로가 있으면 설정을 무시하고 기존 인스턴스를 반환합니다.</p>
     */
    public CircuitBreaker getOrCreate(CircuitBreakerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return circuits.computeIfAbsent(config.name(), n -> create(config));
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(circuits.get(name));
    }

    public boolean remove(String name) {
        return circuits.remove(name) != null;
    }

    /**
     * 모든 회로 리셋.
     */
    public void resetAll() {
        circuits.values().forEach(DefaultCircuitBreaker::reset);
        log.info("Reset {} circuits", circuits.size());
    }

    /**
     * 회로별 메트릭 (이름순).
     */
    public Map<String, CircuitMetrics> getAllMetrics() {
        Map<String, CircuitMetrics> metrics = new LinkedHashMap<>();
        circuits.keySet().stream().sorted()
            .forEach(name -> metrics.put(name, circuits.get(name).getMetrics()));
        return metrics;
    }

    public int size() {
        return circuits.size();
    }

    @Override
    public void close() {
        executor.shutdownNow();
        circuits.clear();
    }

    private DefaultCircuitBreaker create(CircuitBreakerConfig config) {
        log.debug("Creating circuit {} (failureThreshold={}, recoveryTimeoutMs={})",
            config.name(), config.failureThreshold(), config.recoveryTimeoutMs());
        return new DefaultCircuitBreaker(config, executor, clock);
    }
}
