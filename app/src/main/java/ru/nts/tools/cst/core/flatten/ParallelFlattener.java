/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.cst.core.flatten;

import ru.nts.tools.cst.core.Diagnostics;
import ru.nts.tools.cst.core.policy.ExtractionPolicy;
import ru.nts.tools.cst.core.treesitter.ParseFailureException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Параллельный разбор набора файлов.
 * Каждый файл обрабатывается отдельным вызовом движка на своем потоке,
 * общими остаются только неизменяемые таблицы языков.
 */
public final class ParallelFlattener implements AutoCloseable {

    private final FlatteningEngine engine;
    private final ExecutorService executor;

    public ParallelFlattener(FlatteningEngine engine, int threads) {
        this.engine = Objects.requireNonNull(engine, "engine");
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.executor = Executors.newFixedThreadPool(threads);
    }

    public ParallelFlattener(FlatteningEngine engine) {
        this(engine, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Разбирает все файлы. Порядок итогов совпадает с порядком входа.
     *
     * @param units файлы
     * @param policy политика извлечения
     * @param ignoreErrors true - ошибки остаются в итогах; false - первая ошибка (по порядку входа) пробрасывается
     * @throws ParseFailureException при ошибке и ignoreErrors == false
     */
    public List<FileOutcome> flattenAll(List<SourceUnit> units, ExtractionPolicy policy, boolean ignoreErrors) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(policy, "policy");

        List<CompletableFuture<FileOutcome>> futures = units.stream()
                .map(unit -> CompletableFuture.supplyAsync(() -> flattenOne(unit, policy), executor))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<FileOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        for (FileOutcome outcome : outcomes) {
            if (outcome.isSuccess()) {
                continue;
            }
            if (!ignoreErrors) {
                throw outcome.error();
            }
            Diagnostics.warn("Skipping " + outcome.path(), outcome.error());
        }
        return outcomes;
    }

    private FileOutcome flattenOne(SourceUnit unit, ExtractionPolicy policy) {
        try {
            return FileOutcome.success(unit, engine.flatten(unit.source(), unit.language(), unit.path(), policy));
        } catch (ParseFailureException e) {
            return FileOutcome.failure(unit, e);
        } catch (RuntimeException e) {
            return FileOutcome.failure(unit, new ParseFailureException(unit.language(), e.getMessage(), e));
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
