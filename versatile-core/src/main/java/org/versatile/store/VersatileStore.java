/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.versatile.store;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.sql.DataSource;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.versatile.commons.Clock;
import org.versatile.commons.PerfLogger;
import org.versatile.security.authorization.AccessResolver;
import org.versatile.security.authorization.AccessRule;
import org.versatile.security.authorization.AccessRuleExtractor;
import org.versatile.security.authorization.AccessRuleStore;
import org.versatile.security.authorization.PrincipalProvider;
import org.versatile.store.dictionary.FieldCoordinate;
import org.versatile.store.dictionary.FieldDictionary;
import org.versatile.store.dictionary.FieldEntry;
import org.versatile.store.dictionary.NameDictionary;
import org.versatile.store.dictionary.WellKnownNames;
import org.versatile.store.lock.Lease;
import org.versatile.store.lock.LeaseManager;
import org.versatile.store.lock.Lock;
import org.versatile.store.lock.LockManager;
import org.versatile.store.lock.LockResult;
import org.versatile.store.rdb.RDBConnectionHandler;
import org.versatile.store.rdb.RDBOptions;
import org.versatile.store.rdb.RDBSchema;
import org.versatile.store.revision.IdentityGuard;
import org.versatile.store.revision.RevisionRow;
import org.versatile.store.revision.RevisionStore;
import org.versatile.store.search.SearchOptions;
import org.versatile.store.search.TextLineIndex;
import org.versatile.store.search.TextSearch;
import org.versatile.store.value.AttributeSlot;
import org.versatile.store.value.AttributeValueStore;
import org.versatile.store.value.ValueClassifier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A revisioned store of structured documents on a relational backend.
 * <p>
 * Documents are identified by container and name. Every save creates a new
 * version; the previous version is kept as a superseded revision. Each
 * operation runs in its own transaction. Names and fields created while
 * saving are committed before the revision itself, so they stay in place
 * even if the save fails later on.
 * <p>
 * Writers of the same document wait for each other through an
 * {@link IdentityGuard}, so a document has a single latest revision and
 * its versions have no gaps.
 * <p>
 * Instances are thread-safe. Use {@link #builder()} to create one.
 */
public final class VersatileStore {

    private static final Logger LOG = LoggerFactory.getLogger(VersatileStore.class);

    private static final PerfLogger PERFLOG = new PerfLogger(
            LoggerFactory.getLogger(VersatileStore.class.getName() + ".perf"));

    private final Clock clock;
    private final VersatileConfiguration configuration;
    private final RDBOptions options;
    private final RDBConnectionHandler connectionHandler;
    private final RDBSchema schema;
    private final NameDictionary names;
    private final FieldDictionary fields;
    private final RevisionStore revisions;
    private final IdentityGuard guard;
    private final AttributeValueStore values;
    private final TextLineIndex lines;
    private final AccessRuleExtractor ruleExtractor;
    private final AccessRuleStore accessRules;
    private final LockManager locks;
    private final LeaseManager leases;
    private final TextSearch search;

    private VersatileStore(Builder builder) {
        this.clock = builder.clock;
        this.configuration = builder.configuration;
        this.options = builder.options;
        this.connectionHandler = new RDBConnectionHandler(builder.dataSource);
        this.schema = new RDBSchema(options);
        long threshold = configuration.getPerfLogThreshold();
        this.names = new NameDictionary(schema, threshold);
        this.fields = new FieldDictionary(schema, names, threshold);
        this.revisions = new RevisionStore(schema);
        this.guard = new IdentityGuard(schema);
        this.values = new AttributeValueStore(schema, fields, new ValueClassifier(), threshold);
        this.lines = new TextLineIndex(schema);
        this.ruleExtractor = new AccessRuleExtractor(configuration.getUsersContainer());
        this.accessRules = new AccessRuleStore(schema, threshold);
        this.locks = new LockManager(schema, names, clock);
        this.leases = new LeaseManager(schema, names);
        this.search = new TextSearch(schema, configuration.getSearchBatchSize(), threshold);
        execute("initialization", c -> {
            schema.initialize(c);
            return null;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    //--------------------------------------------------------------< write >

    /**
     * Saves a new revision of a document.
     * <p>
     * An identity that is not {@link DocumentIdentity#isValid() valid} is
     * ignored and {@code 0} is returned.
     *
     * @param identity the document
     * @param content the content of the new revision
     * @param author the author of the revision
     * @param options the save options
     * @return the version of the saved revision
     * @throws IllegalArgumentException if the content has an unnamed record
     *          next to other records, or duplicate record names
     * @throws VersatileException if the backend fails
     */
    public int save(@NotNull final DocumentIdentity identity, @NotNull final StructuredDocument content,
                    @NotNull final String author, @NotNull final SaveOptions options) {
        checkNotNull(content);
        checkNotNull(author);
        if (!identity.isValid()) {
            LOG.warn("Ignoring save of document with malformed identity '{}'", identity);
            return 0;
        }
        final List<AttributeSlot> slots = AttributeValueStore.decompose(content);
        final boolean historic = options.getExplicitVersion() != null && !options.isLatest()
                && !options.isAmendInPlace();
        final List<AccessRule> rules = historic
                ? Collections.<AccessRule>emptyList() : ruleExtractor.extract(content);

        long start = PERFLOG.start();
        int version = execute("Save of " + identity, c -> {
            Set<String> referenced = new HashSet<String>(Arrays.asList(identity.getContainer(),
                    identity.getDocument(), author, options.getComment()));
            for (AccessRule rule : rules) {
                referenced.add(rule.getPrincipal());
            }
            Map<String, Long> nids = names.resolve(c, referenced);
            Map<FieldCoordinate, FieldEntry> fieldMap = fields.resolve(c, AttributeValueStore.getCoordinates(slots));

            long time = options.getForceTimestamp() != null ? options.getForceTimestamp() : clock.getTime();
            long authorNid = nids.get(author);
            long commentNid = nids.get(options.getComment());
            long containerNid = nids.get(identity.getContainer());
            long docNid = nids.get(identity.getDocument());
            guard.lock(c, IdentityGuard.Key.document(containerNid, docNid));
            long containerId = revisions.getOrCreateContainer(c, guard, containerNid, authorNid, time);
            RevisionRow latest = revisions.getLatest(c, containerId, docNid);

            long revId;
            int v;
            if (options.isAmendInPlace() && latest != null) {
                revId = latest.getId();
                v = latest.getVersion();
                revisions.update(c, revId, Namespace.LATEST, v, time, authorNid, commentNid, v);
                purgeContent(c, revId);
            } else if (historic) {
                v = options.getExplicitVersion();
                revId = revisions.insert(c, Namespace.OTHER, containerId, docNid, v, time, authorNid, commentNid, null);
            } else {
                if (options.getExplicitVersion() != null) {
                    v = options.getExplicitVersion();
                } else {
                    v = latest == null ? 1 : latest.getVersion() + 1;
                }
                if (latest != null) {
                    retag(c, latest.getId(), true);
                }
                RevisionRow dangling = latest == null ? revisions.getDangling(c, containerId, docNid) : null;
                if (dangling != null) {
                    revId = dangling.getId();
                    revisions.update(c, revId, Namespace.LATEST, v, time, authorNid, commentNid, null);
                } else {
                    revId = revisions.insert(c, Namespace.LATEST, containerId, docNid, v, time,
                            authorNid, commentNid, null);
                }
            }
            values.insert(c, revId, historic, slots, fieldMap);
            lines.insert(c, revId, historic, content);
            if (!historic) {
                accessRules.insert(c, revId, rules, nids);
            }
            return v;
        });
        PERFLOG.end(start, configuration.getPerfLogThreshold(), "save: {} version {}, {} values",
                identity, version, slots.size());
        LOG.debug("{} saved {} version {}", author, identity, version);
        return version;
    }

    /**
     * Restores the previous revision of a document. The latest revision is
     * deleted.
     *
     * @param identity the document
     * @param author the principal rolling back
     * @return the restored version
     * @throws VersatileException if the document does not exist, is at
     *          version 1 or has no prior revision
     */
    public int rollback(@NotNull final DocumentIdentity identity, @NotNull final String author) {
        return execute("Rollback of " + identity, c -> {
            Location loc = locate(c, identity);
            if (loc != null) {
                guard.lock(c, IdentityGuard.Key.document(loc.containerNid, loc.docNid));
            }
            RevisionRow latest = loc == null ? null : revisions.getLatest(c, loc.containerId, loc.docNid);
            if (latest == null) {
                throw new VersatileException("Cannot roll back " + identity + ": document does not exist");
            }
            if (latest.getVersion() == 1) {
                throw new VersatileException("Cannot roll back " + identity + ": it is at version 1");
            }
            RevisionRow prior = revisions.getNewestOther(c, loc.containerId, loc.docNid);
            if (prior == null) {
                throw new VersatileException("Cannot roll back " + identity + ": no prior revision");
            }
            purgeContent(c, latest.getId());
            revisions.delete(c, latest.getId());
            retag(c, prior.getId(), false);
            LOG.debug("{} rolled back {} from version {} to {}", author, identity,
                    latest.getVersion(), prior.getVersion());
            return prior.getVersion();
        });
    }

    /**
     * Moves the latest revision of a document to a new identity. Superseded
     * revisions keep the old identity. A lease on the document moves along,
     * unless the new identity has a lease of its own.
     *
     * @throws VersatileException if the document does not exist or the new
     *          identity is taken
     */
    public void rename(@NotNull final DocumentIdentity from, @NotNull final DocumentIdentity to) {
        checkArgument(from.isValid() && to.isValid(), "Cannot rename %s to %s", from, to);
        execute("Rename of " + from + " to " + to, c -> {
            Map<String, Long> nids = names.resolve(c, Arrays.asList(from.getContainer(), from.getDocument(),
                    to.getContainer(), to.getDocument()));
            long fromContainerNid = nids.get(from.getContainer());
            long fromDocNid = nids.get(from.getDocument());
            long toContainerNid = nids.get(to.getContainer());
            long toDocNid = nids.get(to.getDocument());
            guard.lock(c, IdentityGuard.Key.document(fromContainerNid, fromDocNid),
                    IdentityGuard.Key.document(toContainerNid, toDocNid));

            Long fromContainerId = revisions.getContainerId(c, fromContainerNid);
            RevisionRow latest = fromContainerId == null ? null : revisions.getLatest(c, fromContainerId, fromDocNid);
            if (latest == null) {
                throw new VersatileException("Cannot rename " + from + ": document does not exist");
            }
            long toContainerId = revisions.getOrCreateContainer(c, guard, toContainerNid,
                    WellKnownNames.EMPTY_ID, clock.getTime());
            if (revisions.getLatest(c, toContainerId, toDocNid) != null) {
                throw new VersatileException("Cannot rename " + from + ": " + to + " already exists");
            }
            revisions.move(c, latest.getId(), toContainerId, toDocNid);
            boolean leaseMoved = leases.move(c, fromContainerNid, fromDocNid, toContainerNid, toDocNid);
            LOG.debug("Renamed {} to {} (lease moved: {})", from, to, leaseMoved);
            return null;
        });
    }

    /**
     * Renames a container, and all containers nested below it.
     *
     * @throws VersatileException if the container does not exist or a new
     *          container name is taken
     */
    public void renameContainer(@NotNull final String from, @NotNull final String to) {
        checkArgument(!from.isEmpty() && !to.isEmpty(), "Cannot rename container %s to %s", from, to);
        execute("Rename of container " + from + " to " + to, c -> {
            lockContainers(c, from, to);
            Map<String, RevisionRow> existing = new LinkedHashMap<String, RevisionRow>();
            for (RevisionRow row : revisions.getContainers(c)) {
                existing.put(row.getName(), row);
            }
            Map<RevisionRow, String> renames = new LinkedHashMap<RevisionRow, String>();
            for (Map.Entry<String, RevisionRow> e : existing.entrySet()) {
                String name = e.getKey();
                if (name.equals(from) || name.startsWith(from + "/")) {
                    renames.put(e.getValue(), to + name.substring(from.length()));
                }
            }
            if (renames.isEmpty()) {
                throw new VersatileException("Cannot rename container " + from + ": it does not exist");
            }
            for (String target : renames.values()) {
                if (existing.containsKey(target)) {
                    throw new VersatileException("Cannot rename container " + from + ": " + target + " already exists");
                }
            }
            Map<String, Long> nids = names.resolve(c, renames.values());
            for (Map.Entry<RevisionRow, String> e : renames.entrySet()) {
                revisions.move(c, e.getKey().getId(), RDBSchema.ROOT_ID, nids.get(e.getValue()));
            }
            LOG.debug("Renamed {} containers from {} to {}", renames.size(), from, to);
            return null;
        });
    }

    /**
     * Purges a document: all its revisions, its lock and its lease.
     *
     * @return {@code true} if anything was removed
     */
    public boolean remove(@NotNull final DocumentIdentity identity) {
        return execute("Removal of " + identity, c -> {
            Location loc = locate(c, identity);
            if (loc == null) {
                return false;
            }
            guard.lock(c, IdentityGuard.Key.document(loc.containerNid, loc.docNid));
            List<RevisionRow> rows = revisions.getAllRevisions(c, loc.containerId, loc.docNid);
            for (RevisionRow row : rows) {
                purgeContent(c, row.getId());
                revisions.delete(c, row.getId());
            }
            locks.remove(c, loc.containerNid, loc.docNid);
            leases.remove(c, loc.containerNid, loc.docNid);
            LOG.debug("Removed {} revisions of {}", rows.size(), identity);
            return !rows.isEmpty();
        });
    }

    /**
     * Purges a container, the containers nested below it and all their
     * documents.
     *
     * @return {@code true} if the container existed
     */
    public boolean removeContainer(@NotNull final String container) {
        return execute("Removal of container " + container, c -> {
            lockContainers(c, container, null);
            int count = 0;
            for (RevisionRow row : revisions.getContainers(c)) {
                String name = row.getName();
                if (!name.equals(container) && !name.startsWith(container + "/")) {
                    continue;
                }
                for (RevisionRow rev : revisions.getAllRevisions(c, row.getId())) {
                    purgeContent(c, rev.getId());
                    revisions.delete(c, rev.getId());
                }
                revisions.delete(c, row.getId());
                count++;
            }
            LOG.debug("Removed {} containers at {}", count, container);
            return count > 0;
        });
    }

    /**
     * Reserves a document identity with a placeholder revision that has no
     * content. The first save of the document uses the placeholder.
     *
     * @return {@code false} if the document exists or is already reserved
     */
    public boolean reserve(@NotNull final DocumentIdentity identity, @NotNull final String author) {
        checkArgument(identity.isValid(), "Cannot reserve %s", identity);
        return execute("Reservation of " + identity, c -> {
            Map<String, Long> nids = names.resolve(c,
                    Arrays.asList(identity.getContainer(), identity.getDocument(), author));
            long time = clock.getTime();
            long authorNid = nids.get(author);
            long containerNid = nids.get(identity.getContainer());
            long docNid = nids.get(identity.getDocument());
            guard.lock(c, IdentityGuard.Key.document(containerNid, docNid));
            long containerId = revisions.getOrCreateContainer(c, guard, containerNid, authorNid, time);
            if (revisions.getLatest(c, containerId, docNid) != null
                    || revisions.getDangling(c, containerId, docNid) != null) {
                return false;
            }
            revisions.insert(c, Namespace.DANGLING, containerId, docNid, 0, time, authorNid,
                    WellKnownNames.EMPTY_ID, null);
            return true;
        });
    }

    //---------------------------------------------------------------< read >

    /**
     * Reads the latest revision of a document.
     *
     * @return the revision or {@code null} if the document does not exist
     */
    @Nullable
    public DocumentRevision read(@NotNull DocumentIdentity identity) {
        return read(identity, null);
    }

    /**
     * Reads a revision of a document. If the requested version does not
     * exist, the next higher one is returned.
     *
     * @param identity the document
     * @param version the version, or {@code null} for the latest
     * @return the revision or {@code null} if no matching revision exists
     */
    @Nullable
    public DocumentRevision read(@NotNull final DocumentIdentity identity, @Nullable final Integer version) {
        long start = PERFLOG.start();
        DocumentRevision result = execute("Read of " + identity, c -> {
            RevisionRow row = findRevision(c, identity, version);
            return row == null ? null
                    : new DocumentRevision(identity, toInfo(row), values.read(c, row.getId()));
        });
        PERFLOG.end(start, configuration.getPerfLogThreshold(), "read: {} version {}", identity, version);
        return result;
    }

    /**
     * Reads the latest revisions of many documents, with one value query
     * for all of them.
     *
     * @return the revisions by identity, documents that do not exist are
     *          absent
     */
    @NotNull
    public Map<DocumentIdentity, DocumentRevision> readAll(@NotNull final Collection<DocumentIdentity> identities) {
        return execute("Bulk read", c -> {
            Map<Long, DocumentIdentity> byRevision = new LinkedHashMap<Long, DocumentIdentity>();
            Map<Long, RevisionRow> rows = new HashMap<Long, RevisionRow>();
            for (DocumentIdentity identity : identities) {
                RevisionRow row = findRevision(c, identity, null);
                if (row != null) {
                    byRevision.put(row.getId(), identity);
                    rows.put(row.getId(), row);
                }
            }
            Map<DocumentIdentity, DocumentRevision> result = new LinkedHashMap<DocumentIdentity, DocumentRevision>();
            if (byRevision.isEmpty()) {
                return result;
            }
            Map<Long, StructuredDocument> contents = values.readAll(c, byRevision.keySet());
            for (Map.Entry<Long, DocumentIdentity> e : byRevision.entrySet()) {
                result.put(e.getValue(), new DocumentRevision(e.getValue(),
                        toInfo(rows.get(e.getKey())), contents.get(e.getKey())));
            }
            return result;
        });
    }

    /**
     * @return the metadata of a revision, or {@code null}
     * @see #read(DocumentIdentity, Integer)
     */
    @Nullable
    public RevisionInfo getRevisionInfo(@NotNull final DocumentIdentity identity, @Nullable final Integer version) {
        return execute("Revision info of " + identity, c -> {
            RevisionRow row = findRevision(c, identity, version);
            return row == null ? null : toInfo(row);
        });
    }

    /**
     * @return whether the document has a latest revision
     */
    public boolean exists(@NotNull final DocumentIdentity identity) {
        return execute("Existence check of " + identity, c -> findRevision(c, identity, null) != null);
    }

    public boolean containerExists(@NotNull final String container) {
        return execute("Existence check of container " + container, c -> {
            Long nid = names.lookup(c, container);
            return nid != null && revisions.getContainerId(c, nid) != null;
        });
    }

    /**
     * @return the versions of a document, newest first
     */
    @NotNull
    public List<Integer> getRevisionHistory(@NotNull final DocumentIdentity identity) {
        return execute("History of " + identity, c -> {
            List<Integer> versions = new ArrayList<Integer>();
            Location loc = locate(c, identity);
            if (loc != null) {
                for (RevisionRow row : revisions.getHistory(c, loc.containerId, loc.docNid)) {
                    if (!versions.contains(row.getVersion())) {
                        versions.add(row.getVersion());
                    }
                }
            }
            return versions;
        });
    }

    /**
     * @return the version the next save of the document gets
     */
    public int getNextRevision(@NotNull final DocumentIdentity identity) {
        return execute("Next revision of " + identity, c -> {
            RevisionRow latest = findRevision(c, identity, null);
            return latest == null ? 1 : latest.getVersion() + 1;
        });
    }

    /**
     * @param time milliseconds since the epoch
     * @return the version that was current at the given time, or
     *          {@code null} if the document did not exist then
     */
    @Nullable
    public Integer getRevisionAtTime(@NotNull final DocumentIdentity identity, final long time) {
        return execute("Revision at time of " + identity, c -> {
            Location loc = locate(c, identity);
            RevisionRow row = loc == null ? null : revisions.findAtTime(c, loc.containerId, loc.docNid, time);
            return row == null ? null : row.getVersion();
        });
    }

    //-----------------------------------------------------------< enumerate >

    /**
     * @return the names of the documents of a container, in order
     */
    @NotNull
    public List<String> enumerateDocuments(@NotNull final String container) {
        return execute("Enumeration of " + container, c -> {
            List<String> result = new ArrayList<String>();
            Long nid = names.lookup(c, container);
            Long containerId = nid == null ? null : revisions.getContainerId(c, nid);
            if (containerId != null) {
                for (RevisionRow row : revisions.getLatestRevisions(c, containerId)) {
                    result.add(row.getName());
                }
            }
            return result;
        });
    }

    /**
     * @param parent the parent container, or {@code null} or the empty
     *          string for the top level
     * @param recursive whether to include nested containers at any depth
     * @return the container names, in order
     */
    @NotNull
    public List<String> enumerateContainers(@Nullable final String parent, final boolean recursive) {
        final String prefix = parent == null || parent.isEmpty() ? "" : parent + "/";
        return execute("Enumeration of containers", c -> {
            List<String> result = new ArrayList<String>();
            for (RevisionRow row : revisions.getContainers(c)) {
                String name = row.getName();
                if (name.startsWith(prefix) && name.length() > prefix.length()
                        && (recursive || name.indexOf('/', prefix.length()) < 0)) {
                    result.add(name);
                }
            }
            return result;
        });
    }

    //-------------------------------------------------------------< search >

    /**
     * Searches the latest revisions of a container line by line.
     *
     * @return the matching lines by document name, ordered by name
     */
    @NotNull
    public Map<String, List<String>> textSearch(@NotNull final String pattern, @NotNull final String container,
                                                @NotNull final SearchOptions options) {
        return execute("Search in " + container, c -> {
            Long nid = names.lookup(c, container);
            Long containerId = nid == null ? null : revisions.getContainerId(c, nid);
            if (containerId == null) {
                return Collections.<String, List<String>>emptyMap();
            }
            return search.search(c, pattern, containerId, options);
        });
    }

    //--------------------------------------------------------------< locks >

    /**
     * Tries to lock a document. Never waits.
     *
     * @return the result; a conflict if someone else holds the lock
     */
    @NotNull
    public LockResult acquireLock(@NotNull final DocumentIdentity identity, @NotNull final String holder) {
        return execute("Locking of " + identity, c -> locks.acquire(c, identity, holder));
    }

    /**
     * @return {@code true} if the holder's lock was released
     */
    public boolean releaseLock(@NotNull final DocumentIdentity identity, @NotNull final String holder) {
        return execute("Unlocking of " + identity, c -> locks.release(c, identity, holder));
    }

    @Nullable
    public Lock getLock(@NotNull final DocumentIdentity identity) {
        return execute("Lock lookup of " + identity, c -> locks.get(c, identity));
    }

    @Nullable
    public Lease getLease(@NotNull final DocumentIdentity identity) {
        return execute("Lease lookup of " + identity, c -> leases.get(c, identity));
    }

    /**
     * Sets or, with a {@code null} lease, clears the lease of a document.
     */
    public void setLease(@NotNull final DocumentIdentity identity, @Nullable final Lease lease) {
        execute("Setting lease of " + identity, c -> {
            leases.set(c, identity, lease);
            return null;
        });
    }

    /**
     * Deletes all leases that expired before the current time of the
     * store's clock.
     *
     * @return the number of deleted leases
     */
    public int sweepExpiredLeases() {
        final long now = clock.getTime();
        return execute("Lease sweep", c -> leases.sweep(c, now));
    }

    //-------------------------------------------------------------< access >

    /**
     * Creates a resolver for the access checks of one request.
     */
    @NotNull
    public AccessResolver newAccessResolver(@NotNull PrincipalProvider principalProvider) {
        return new AccessResolver(connectionHandler, names, revisions, accessRules, configuration, principalProvider);
    }

    //-----------------------------------------------------------< lifecycle >

    @NotNull
    public VersatileConfiguration getConfiguration() {
        return configuration;
    }

    @NotNull
    public Clock getClock() {
        return clock;
    }

    /**
     * Releases the store. Drops the tables if configured to.
     */
    public void dispose() {
        if (options.isDropTablesOnClose()) {
            execute("Dropping tables", c -> {
                schema.dropTables(c);
                return null;
            });
        }
        names.dispose();
        fields.dispose();
        connectionHandler.close();
    }

    //------------------------------------------------------------< internal >

    private interface Work<T> {
        T run(Connection connection) throws SQLException;
    }

    /**
     * Runs the work in a transaction, committing at the end. On failure the
     * uncommitted part is rolled back explicitly.
     */
    private <T> T execute(String description, Work<T> work) {
        Connection connection = null;
        try {
            connection = connectionHandler.getRWConnection();
            T result = work.run(connection);
            connection.commit();
            return result;
        } catch (SQLException ex) {
            connectionHandler.rollbackConnection(connection);
            throw VersatileException.convert(ex, description + " failed");
        } catch (RuntimeException ex) {
            connectionHandler.rollbackConnection(connection);
            throw ex;
        } finally {
            connectionHandler.closeConnection(connection);
        }
    }

    private void retag(Connection c, long revId, boolean other) throws SQLException {
        revisions.setNamespace(c, revId, other ? Namespace.OTHER : Namespace.LATEST);
        values.retag(c, revId, other);
        lines.retag(c, revId, other);
    }

    private void purgeContent(Connection c, long revId) throws SQLException {
        values.delete(c, revId);
        lines.delete(c, revId);
        accessRules.delete(c, revId);
    }

    /**
     * Locks the identity rows of a container and the containers nested
     * below it, and of their new names if they are to be renamed.
     */
    private void lockContainers(Connection c, String container, @Nullable String renameTo) throws SQLException {
        Set<String> targets = new HashSet<String>();
        List<Long> containerNids = new ArrayList<Long>();
        for (RevisionRow row : revisions.getContainers(c)) {
            String name = row.getName();
            if (name.equals(container) || name.startsWith(container + "/")) {
                containerNids.add(row.getNid());
                if (renameTo != null) {
                    targets.add(renameTo + name.substring(container.length()));
                }
            }
        }
        containerNids.addAll(names.resolve(c, targets).values());
        IdentityGuard.Key[] keys = new IdentityGuard.Key[containerNids.size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = IdentityGuard.Key.container(containerNids.get(i));
        }
        guard.lock(c, keys);
    }

    @Nullable
    private RevisionRow findRevision(Connection c, DocumentIdentity identity, @Nullable Integer version)
            throws SQLException {
        Location loc = locate(c, identity);
        if (loc == null) {
            return null;
        }
        return version == null || version <= 0
                ? revisions.getLatest(c, loc.containerId, loc.docNid)
                : revisions.find(c, loc.containerId, loc.docNid, version);
    }

    @Nullable
    private Location locate(Connection c, DocumentIdentity identity) throws SQLException {
        Map<String, Long> nids = names.lookup(c, Arrays.asList(identity.getContainer(), identity.getDocument()));
        Long containerNid = nids.get(identity.getContainer());
        Long docNid = nids.get(identity.getDocument());
        if (containerNid == null || docNid == null) {
            return null;
        }
        Long containerId = revisions.getContainerId(c, containerNid);
        return containerId == null ? null : new Location(containerNid, containerId, docNid);
    }

    private RevisionInfo toInfo(RevisionRow row) {
        String author = row.getAuthor().isEmpty() ? configuration.getUnknownAuthor() : row.getAuthor();
        return new RevisionInfo(row.getVersion(), row.getTime(), author, row.getComment(),
                row.getReprev(), row.getNamespace() == Namespace.LATEST);
    }

    private static final class Location {

        final long containerNid;
        final long containerId;
        final long docNid;

        Location(long containerNid, long containerId, long docNid) {
            this.containerNid = containerNid;
            this.containerId = containerId;
            this.docNid = docNid;
        }
    }

    //-------------------------------------------------------------< builder >

    /**
     * A builder for a {@link VersatileStore}.
     */
    public static final class Builder {

        private DataSource dataSource;
        private Clock clock = Clock.SIMPLE;
        private RDBOptions options = new RDBOptions();
        private VersatileConfiguration configuration;

        private Builder() {
        }

        public Builder setDataSource(@NotNull DataSource dataSource) {
            this.dataSource = checkNotNull(dataSource);
            return this;
        }

        public Builder setClock(@NotNull Clock clock) {
            this.clock = checkNotNull(clock);
            return this;
        }

        public Builder setRDBOptions(@NotNull RDBOptions options) {
            this.options = checkNotNull(options);
            return this;
        }

        public Builder setConfiguration(@NotNull VersatileConfiguration configuration) {
            this.configuration = checkNotNull(configuration);
            return this;
        }

        /**
         * Creates the store, creating missing tables.
         *
         * @throws VersatileException if the backend fails
         */
        public VersatileStore build() {
            checkNotNull(dataSource, "dataSource not set");
            if (configuration == null) {
                configuration = VersatileConfiguration.fromSystemProperties();
            }
            return new VersatileStore(this);
        }
    }
}
