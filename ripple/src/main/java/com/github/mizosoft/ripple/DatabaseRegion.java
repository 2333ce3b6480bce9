/*
 * Copyright (c) 2024 Moataz Hussein
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.ripple;

import static com.github.mizosoft.ripple.internal.Validate.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A set of database tables, or the whole database, that an observation is interested in. Table
 * names are case-insensitive.
 */
public final class DatabaseRegion {
  private static final DatabaseRegion EMPTY = new DatabaseRegion(Set.of(), false);
  private static final DatabaseRegion FULL_DATABASE = new DatabaseRegion(Set.of(), true);

  private final Set<String> tables;
  private final boolean fullDatabase;

  private DatabaseRegion(Set<String> tables, boolean fullDatabase) {
    this.tables = tables;
    this.fullDatabase = fullDatabase;
  }

  /** Returns the tables in this region. Empty if this region is empty or the full database. */
  public Set<String> tables() {
    return tables;
  }

  public boolean isFullDatabase() {
    return fullDatabase;
  }

  public boolean isEmpty() {
    return !fullDatabase && tables.isEmpty();
  }

  /** Returns {@code true} if a transaction modifying the given tables modifies this region. */
  public boolean isModifiedBy(Collection<String> modifiedTables) {
    if (modifiedTables.isEmpty()) {
      return false;
    }
    if (fullDatabase) {
      return true;
    }
    for (var table : modifiedTables) {
      if (tables.contains(normalize(table))) {
        return true;
      }
    }
    return false;
  }

  /** Returns a region that contains both this region and the given one. */
  public DatabaseRegion union(DatabaseRegion other) {
    requireNonNull(other);
    if (fullDatabase || other.fullDatabase) {
      return FULL_DATABASE;
    }
    var union = new HashSet<>(tables);
    union.addAll(other.tables);
    return new DatabaseRegion(Set.copyOf(union), false);
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof DatabaseRegion)) {
      return false;
    }
    var other = (DatabaseRegion) obj;
    return fullDatabase == other.fullDatabase && tables.equals(other.tables);
  }

  @Override
  public int hashCode() {
    return 31 * tables.hashCode() + Boolean.hashCode(fullDatabase);
  }

  @Override
  public String toString() {
    return fullDatabase ? "DatabaseRegion[full]" : "DatabaseRegion" + new TreeSet<>(tables);
  }

  /** Returns a region made of the given tables. */
  public static DatabaseRegion of(String... tables) {
    return of(Set.of(tables));
  }

  /** Returns a region made of the given tables. */
  public static DatabaseRegion of(Collection<String> tables) {
    var normalized = new HashSet<String>();
    for (var table : tables) {
      requireArgument(!table.isBlank(), "blank table name");
      normalized.add(normalize(table));
    }
    return normalized.isEmpty() ? EMPTY : new DatabaseRegion(Set.copyOf(normalized), false);
  }

  public static DatabaseRegion empty() {
    return EMPTY;
  }

  /** Returns the region that is modified by any change to the database. */
  public static DatabaseRegion fullDatabase() {
    return FULL_DATABASE;
  }

  private static String normalize(String table) {
    return table.toLowerCase(Locale.ROOT);
  }
}
