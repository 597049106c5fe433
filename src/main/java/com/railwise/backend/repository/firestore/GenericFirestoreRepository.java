package com.railwise.backend.repository.firestore;

import com.google.api.core.ApiFuture;
import com.google.cloud.firestore.*;
import com.railwise.backend.repository.DataRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Generic Firestore repository implementation. Every operation is a no-op
 * when Firestore is not configured, so callers keep working from memory.
 *
 * @param <T>  The entity type
 * @param <ID> The ID type
 */
@Slf4j
public class GenericFirestoreRepository<T, ID> implements DataRepository<T, ID> {

    protected final Firestore firestore;
    protected final String collectionName;
    protected final Class<T> entityClass;
    protected final Function<T, String> idExtractor;

    public GenericFirestoreRepository(Firestore firestore, String collectionName,
            Class<T> entityClass, Function<T, String> idExtractor) {
        this.firestore = firestore;
        this.collectionName = collectionName;
        this.entityClass = entityClass;
        this.idExtractor = idExtractor;
    }

    @Override
    public void save(T entity) {
        if (firestore == null)
            return;
        String id = idExtractor.apply(entity);
        try {
            firestore.collection(collectionName)
                    .document(id)
                    .set(entity)
                    .get();
            log.trace("Saved {} to {}", id, collectionName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while saving {} to {}", id, collectionName, e);
        } catch (ExecutionException e) {
            log.error("Failed to save {} to {}", id, collectionName, e);
        }
    }

    @Override
    public List<T> findAll() {
        if (firestore == null)
            return new ArrayList<>();
        List<T> results = new ArrayList<>();
        try {
            ApiFuture<QuerySnapshot> future = firestore.collection(collectionName).get();
            for (QueryDocumentSnapshot doc : future.get().getDocuments()) {
                results.add(doc.toObject(entityClass));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while fetching all from {}", collectionName, e);
        } catch (ExecutionException e) {
            log.error("Failed to fetch all from {}", collectionName, e);
        }
        return results;
    }

    @Override
    public void deleteById(ID id) {
        if (firestore == null)
            return;
        try {
            firestore.collection(collectionName)
                    .document(String.valueOf(id))
                    .delete()
                    .get();
            log.trace("Deleted {} from {}", id, collectionName);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while deleting {} from {}", id, collectionName, e);
        } catch (ExecutionException e) {
            log.error("Failed to delete {} from {}", id, collectionName, e);
        }
    }
}
