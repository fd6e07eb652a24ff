/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.chainhouse.query;

import net.chainhouse.core.ColumnStore;
import net.chainhouse.core.ColumnType;
import net.chainhouse.core.PartitionHandle;
import net.chainhouse.core.Schema;
import net.chainhouse.core.data.ColumnBlockSet;
import net.chainhouse.core.data.ColumnVector;
import net.chainhouse.core.data.RowRange;
import net.chainhouse.index.filter.Predicate;
import net.chainhouse.index.filter.Predicates;
import net.chainhouse.rollup.BucketGranularity;
import net.chainhouse.rollup.RollupBucket;
import net.chainhouse.rollup.RollupDefinition;
import net.chainhouse.rollup.RollupEngine;
import net.chainhouse.rollup.aggregate.AggregateSpec;
import net.chainhouse.scan.OrderBy;
import net.chainhouse.scan.PartitionOutput;
import net.chainhouse.scan.PartitionTasks;
import net.chainhouse.scan.PartitionWorker;
import net.chainhouse.scan.Row;
import net.chainhouse.scan.ScanEngine;
import net.chainhouse.scan.ScanRequest;
import net.chainhouse.scan.ScanResult;
import net.chainhouse.scan.ScanStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates GROUP BY, HAVING, ORDER BY and LIMIT over raw partitions or
 * rollup buckets.
 *
 * <p>On the raw path every partition is aggregated by its own worker and the
 * partial groups are merged in candidate order. Having applies after the
 * merge, then the order and the limit. Rows that tie on the order keep the
 * order in which their groups were first seen: scan ordinal on the raw path,
 * bucket order on the rollup path.
 */
public class AggregationExecutor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AggregationExecutor.class);

  private final ScanEngine scanEngine;
  private final ColumnStore store;
  private final RollupEngine rollupEngine;

  /**
   * @param rollupEngine may be null to always read raw partitions.
   */
  public AggregationExecutor(final ScanEngine scanEngine, final RollupEngine rollupEngine) {
    this.scanEngine = scanEngine;
    this.store = scanEngine.store();
    this.rollupEngine = rollupEngine;
  }

  public QueryResponse execute(final QueryRequest request) {
    request.cancellation().throwIfCancelled();
    final String rollup = chooseRollup(request);
    if (rollup != null) {
      final RollupDefinition definition = rollupEngine.definition(rollup);
      final long from = request.fromTime() == null ? Long.MIN_VALUE : request.fromTime();
      final long to = request.toTime() == null ? Long.MAX_VALUE : request.toTime();
      final List<RollupBucket> buckets = rollupEngine.buckets(rollup, from, to);
      final List<ResultRow> rows = execute(request.groupKeys(), request.aggregates(),
          request.having(), request.orderBy(), request.limit(), definition, buckets);
      LOGGER.debug("Answered {} from rollup {} with {} buckets", request, rollup, buckets.size());
      return new QueryResponse(rows, new ScanStats(), rollup);
    }
    return executeRaw(request);
  }

  private QueryResponse executeRaw(final QueryRequest request) {
    final Schema schema = store.schema(request.table());
    final Map<String, LookupJoin> joined = joinedColumns(schema, request.joins());
    final List<GroupKey> groupKeys = request.groupKeys();
    final List<AggregateSpec> specs = request.aggregates();

    final Set<String> columns = new LinkedHashSet<>();
    for (GroupKey key : groupKeys) {
      final ColumnType type = typeOf(schema, joined, key.column());
      if (key.kind() != GroupKey.Kind.COLUMN && !type.isIntegral()) {
        throw new IllegalArgumentException(key.name() + " needs a timestamp column");
      }
      if (schema.has(key.column())) {
        columns.add(key.column());
      }
    }
    final List<ColumnType> inputTypes = new ArrayList<>(specs.size());
    for (AggregateSpec spec : specs) {
      inputTypes.add(inputType(schema, joined, spec));
      if (spec.condition() != null) {
        for (String column : spec.condition().columns()) {
          schema.typeOf(column);
          columns.add(column);
        }
      }
      if (spec.column() != null && schema.has(spec.column())) {
        columns.add(spec.column());
      }
    }
    for (LookupJoin join : request.joins()) {
      columns.add(join.column());
    }
    if (columns.isEmpty()) {
      columns.add(schema.timeColumn());
    }
    checkOutputNames(groupKeys, specs, request.orderBy());

    final ScanRequest scan = ScanRequest.newBuilder(request.table())
        .primary(request.primary())
        .secondary(request.secondary())
        .timeRange(request.fromTime(), request.toTime())
        .project(new ArrayList<>(columns))
        .cancellation(request.cancellation())
        .build();
    final ScanStats stats = new ScanStats();
    final PartitionTasks<GroupAccumulator> tasks = scanEngine.submit(scan, Collections.emptySet(),
        position -> new GroupingWorker(position, groupKeys, specs, inputTypes, request.joins()),
        stats);
    final GroupAccumulator merged = new GroupAccumulator(specs, inputTypes);
    PartitionOutput<GroupAccumulator> output;
    while ((output = tasks.next()) != null) {
      merged.merge(output.result());
    }
    final List<ResultRow> rows = finish(groupKeys, specs, merged, request.having(),
        request.orderBy(), request.limit());
    LOGGER.debug("Answered {} from raw partitions: {}", request, stats);
    return new QueryResponse(rows, stats, null);
  }

  /**
   * Aggregates the rows of a scan. The rows must carry every column the
   * group keys and aggregates read; ties keep the scan's row order.
   */
  public List<ResultRow> execute(final List<GroupKey> groupKeys,
                                 final List<AggregateSpec> specs,
                                 final Having having,
                                 final List<OrderBy> orderBy,
                                 final int limit,
                                 final ScanResult source) {
    checkOutputNames(groupKeys, specs, orderBy);
    GroupAccumulator accumulator = null;
    Schema schema = null;
    long position = 0;
    for (Row row : source) {
      if (accumulator == null) {
        schema = store.schema(row.partition().table());
        final List<ColumnType> inputTypes = new ArrayList<>(specs.size());
        for (AggregateSpec spec : specs) {
          inputTypes.add(spec.column() == null ? null : schema.typeOf(spec.column()));
        }
        accumulator = new GroupAccumulator(specs, inputTypes);
      }
      final List<Object> keys = new ArrayList<>(groupKeys.size());
      for (GroupKey key : groupKeys) {
        keys.add(key.apply(valueOf(row, key.column())));
      }
      final GroupAccumulator.Group group = accumulator.group(keys, position++);
      for (int i = 0; i < specs.size(); i++) {
        final AggregateSpec spec = specs.get(i);
        if (spec.condition() != null
            && !spec.accepts(singleRow(schema, row, spec.condition().columns()), 0)) {
          continue;
        }
        group.states[i].add(spec.column() == null ? Boolean.TRUE : valueOf(row, spec.column()));
      }
    }
    if (accumulator == null) {
      accumulator = new GroupAccumulator(specs, Collections.nCopies(specs.size(), null));
    }
    return finish(groupKeys, specs, accumulator, having, orderBy, limit);
  }

  /**
   * Aggregates rollup buckets. Every aggregate must be one the rollup
   * computes and every group key must be derivable from its buckets.
   */
  public List<ResultRow> execute(final List<GroupKey> groupKeys,
                                 final List<AggregateSpec> specs,
                                 final Having having,
                                 final List<OrderBy> orderBy,
                                 final int limit,
                                 final RollupDefinition definition,
                                 final List<RollupBucket> buckets) {
    final Schema schema = store.schema(definition.table());
    final String reason = incompatibility(definition, schema, groupKeys, specs);
    if (reason != null) {
      throw new IllegalArgumentException("Rollup " + definition.name() + " cannot answer: " + reason);
    }
    checkOutputNames(groupKeys, specs, orderBy);
    final int[] positions = new int[specs.size()];
    final List<ColumnType> inputTypes = new ArrayList<>(specs.size());
    for (int i = 0; i < specs.size(); i++) {
      final AggregateSpec spec = specs.get(i);
      positions[i] = definition.indexOf(spec);
      inputTypes.add(spec.column() == null ? null : schema.typeOf(spec.column()));
    }
    final GroupAccumulator accumulator = new GroupAccumulator(specs, inputTypes);
    long position = 0;
    for (RollupBucket bucket : buckets) {
      final List<Object> keys = new ArrayList<>(groupKeys.size());
      for (GroupKey key : groupKeys) {
        final Object value = key.column().equals(schema.timeColumn())
            ? bucket.key().bucketStart()
            : bucket.key().dimension(definition.dimensions().indexOf(key.column()));
        keys.add(key.apply(value));
      }
      final GroupAccumulator.Group group = accumulator.group(keys, position++);
      for (int i = 0; i < specs.size(); i++) {
        group.states[i].merge(bucket.state(positions[i]));
      }
    }
    return finish(groupKeys, specs, accumulator, having, orderBy, limit);
  }

  /** @return the rollup to read or null for the raw path. */
  private String chooseRollup(final QueryRequest request) {
    if (request.source() == QuerySource.RAW) {
      return null;
    }
    if (request.source() == QuerySource.ROLLUP) {
      if (rollupEngine == null) {
        throw new IllegalArgumentException("No rollup engine to answer " + request);
      }
      final RollupDefinition definition = rollupEngine.definition(request.rollup());
      final String reason = incompatibility(definition, request);
      if (reason != null) {
        throw new IllegalArgumentException("Rollup " + definition.name()
            + " cannot answer: " + reason);
      }
      return definition.name();
    }
    if (rollupEngine == null) {
      return null;
    }
    final List<RollupDefinition> candidates = new ArrayList<>(rollupEngine.definitions());
    candidates.sort(Comparator
        .comparing((RollupDefinition d) -> d.granularity().getMillis()).reversed()
        .thenComparing(RollupDefinition::name));
    final long from = request.fromTime() == null ? Long.MIN_VALUE : request.fromTime();
    final long to = request.toTime() == null ? Long.MAX_VALUE : request.toTime();
    for (RollupDefinition definition : candidates) {
      if (incompatibility(definition, request) == null
          && rollupEngine.covers(definition.name(), from, to)) {
        return definition.name();
      }
    }
    return null;
  }

  private String incompatibility(final RollupDefinition definition, final QueryRequest request) {
    if (!definition.table().equals(request.table())) {
      return "it summarises " + definition.table();
    }
    if (!request.joins().isEmpty()) {
      return "lookup joins need raw rows";
    }
    final Predicate filter = Predicates.and(request.primary(), request.secondary());
    if (!filter.equals(definition.filter())) {
      return "filter " + filter + " differs from " + definition.filter();
    }
    final BucketGranularity granularity = definition.granularity();
    if (!aligned(granularity, request.fromTime()) || !aligned(granularity, request.toTime())) {
      return "time range is not aligned to " + granularity;
    }
    return incompatibility(definition, store.schema(definition.table()),
        request.groupKeys(), request.aggregates());
  }

  private static String incompatibility(final RollupDefinition definition,
                                        final Schema schema,
                                        final List<GroupKey> groupKeys,
                                        final List<AggregateSpec> specs) {
    for (GroupKey key : groupKeys) {
      switch (key.kind()) {
        case COLUMN:
          if (!definition.dimensions().contains(key.column())) {
            return key.column() + " is not a dimension";
          }
          break;
        case TIME_BUCKET:
          if (!key.column().equals(schema.timeColumn())
              || !definition.granularity().divides(key.granularity())) {
            return key.name() + " is finer than the buckets";
          }
          break;
        default:
          if (!key.column().equals(schema.timeColumn())
              || !definition.granularity().divides(BucketGranularity._1_HR)) {
            return key.name() + " is finer than the buckets";
          }
      }
    }
    for (AggregateSpec spec : specs) {
      if (definition.indexOf(spec) < 0) {
        return spec.name() + " is not computed";
      }
    }
    return null;
  }

  private static boolean aligned(final BucketGranularity granularity, final Long time) {
    return time == null || granularity.bucketStart(time) == time;
  }

  private static Map<String, LookupJoin> joinedColumns(final Schema schema,
                                                       final List<LookupJoin> joins) {
    final Map<String, LookupJoin> joined = new HashMap<>();
    for (LookupJoin join : joins) {
      schema.typeOf(join.column());
      for (String column : join.dimensions().columns()) {
        if (schema.has(column) || joined.put(column, join) != null) {
          throw new IllegalArgumentException("Ambiguous column " + column + " in " + join);
        }
      }
    }
    return joined;
  }

  private static ColumnType typeOf(final Schema schema,
                                   final Map<String, LookupJoin> joined,
                                   final String column) {
    final LookupJoin join = joined.get(column);
    return join == null ? schema.typeOf(column) : join.dimensions().typeOf(column);
  }

  private static ColumnType inputType(final Schema schema,
                                      final Map<String, LookupJoin> joined,
                                      final AggregateSpec spec) {
    if (spec.column() == null) {
      return null;
    }
    final ColumnType type = typeOf(schema, joined, spec.column());
    if (spec.type().requiresNumeric() && !type.isNumeric()) {
      throw new IllegalArgumentException(spec.name() + " needs a numeric column, "
          + spec.column() + " is " + type);
    }
    return type;
  }

  private static void checkOutputNames(final List<GroupKey> groupKeys,
                                       final List<AggregateSpec> specs,
                                       final List<OrderBy> orderBy) {
    final Set<String> names = new HashSet<>();
    for (GroupKey key : groupKeys) {
      if (!names.add(key.name())) {
        throw new IllegalArgumentException("Duplicate output " + key.name());
      }
    }
    for (AggregateSpec spec : specs) {
      if (!names.add(spec.name())) {
        throw new IllegalArgumentException("Duplicate output " + spec.name());
      }
    }
    for (OrderBy order : orderBy) {
      if (!names.contains(order.column())) {
        throw new IllegalArgumentException("Cannot order by " + order.column()
            + ", outputs are " + names);
      }
    }
  }

  private static List<ResultRow> finish(final List<GroupKey> groupKeys,
                                        final List<AggregateSpec> specs,
                                        final GroupAccumulator accumulator,
                                        final Having having,
                                        final List<OrderBy> orderBy,
                                        final int limit) {
    if (accumulator.isEmpty() && groupKeys.isEmpty()) {
      accumulator.group(Collections.emptyList(), 0);
    }
    final List<ResultRow> rows = new ArrayList<>();
    for (GroupAccumulator.Group group : accumulator.groups()) {
      final Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 0; i < groupKeys.size(); i++) {
        values.put(groupKeys.get(i).name(), group.keys.get(i));
      }
      for (int i = 0; i < specs.size(); i++) {
        values.put(specs.get(i).name(), group.states[i].value());
      }
      final ResultRow row = new ResultRow(values, group.firstSeen);
      if (having.test(row)) {
        rows.add(row);
      }
    }
    rows.sort(comparator(orderBy));
    if (limit > 0 && rows.size() > limit) {
      return new ArrayList<>(rows.subList(0, limit));
    }
    return rows;
  }

  static Comparator<ResultRow> comparator(final List<OrderBy> orderBy) {
    Comparator<ResultRow> comparator = null;
    for (OrderBy order : orderBy) {
      final Comparator<ResultRow> next = order.comparator(row -> row.get(order.column()));
      comparator = comparator == null ? next : comparator.thenComparing(next);
    }
    final Comparator<ResultRow> byFirstSeen = Comparator.comparingLong(ResultRow::firstSeen);
    return comparator == null ? byFirstSeen : comparator.thenComparing(byFirstSeen);
  }

  private static Object valueOf(final Row row, final String column) {
    if (!row.values().containsKey(column)) {
      throw new IllegalArgumentException("Scanned rows do not carry " + column);
    }
    return row.get(column);
  }

  private static ColumnBlockSet singleRow(final Schema schema,
                                          final Row row,
                                          final Set<String> columns) {
    final Map<String, ColumnVector> vectors = new HashMap<>();
    for (String column : columns) {
      vectors.put(column, ColumnVector.fromValues(column, schema.typeOf(column),
          new Object[] {valueOf(row, column)}));
    }
    return new ColumnBlockSet(RowRange.of(0, 1), vectors, 0, 0);
  }

  /** Aggregates one partition into its own groups. */
  private static final class GroupingWorker implements PartitionWorker<GroupAccumulator> {

    private final long position;
    private final List<GroupKey> groupKeys;
    private final List<AggregateSpec> specs;
    private final List<LookupJoin> joins;
    private final GroupAccumulator accumulator;

    private GroupingWorker(final int position,
                           final List<GroupKey> groupKeys,
                           final List<AggregateSpec> specs,
                           final List<ColumnType> inputTypes,
                           final List<LookupJoin> joins) {
      this.position = position;
      this.groupKeys = groupKeys;
      this.specs = specs;
      this.joins = joins;
      this.accumulator = new GroupAccumulator(specs, inputTypes);
    }

    @Override
    public boolean visit(final PartitionHandle partition,
                         final ColumnBlockSet block,
                         final int row,
                         final int rowInPartition) {
      Map<String, Object> looked = null;
      for (LookupJoin join : joins) {
        final Map<String, Object> match = join.match(block.value(join.column(), row));
        if (match == null) {
          return true;
        }
        if (!match.isEmpty()) {
          if (looked == null) {
            looked = new HashMap<>();
          }
          looked.putAll(match);
        }
      }
      final List<Object> keys = new ArrayList<>(groupKeys.size());
      for (GroupKey key : groupKeys) {
        keys.add(key.apply(value(block, row, looked, key.column())));
      }
      final GroupAccumulator.Group group =
          accumulator.group(keys, (position << 32) | rowInPartition);
      for (int i = 0; i < specs.size(); i++) {
        final AggregateSpec spec = specs.get(i);
        if (spec.accepts(block, row)) {
          group.states[i].add(spec.column() == null
              ? Boolean.TRUE : value(block, row, looked, spec.column()));
        }
      }
      return true;
    }

    private static Object value(final ColumnBlockSet block,
                                final int row,
                                final Map<String, Object> looked,
                                final String column) {
      if (block.has(column)) {
        return block.value(column, row);
      }
      return looked == null ? null : looked.get(column);
    }

    @Override
    public GroupAccumulator result() {
      return accumulator;
    }
  }
}
