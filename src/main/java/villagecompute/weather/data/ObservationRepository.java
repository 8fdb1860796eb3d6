/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.weather.data;

import java.util.ArrayList;
import java.util.List;

import org.bson.Document;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.weather.api.types.WeatherObservationType;

/**
 * MongoDB storage for fetched weather: one raw document per API call and one enriched document per hourly observation.
 *
 * <p>
 * Documents are converted through Jackson so the stored field names match the JSON wire names of the records.
 */
@ApplicationScoped
public class ObservationRepository {

    private static final Logger LOG = Logger.getLogger(ObservationRepository.class);

    @Inject
    MongoClient mongoClient;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "weather.mongo.database",
            defaultValue = "weather_data")
    String databaseName;

    @ConfigProperty(
            name = "weather.mongo.raw-collection",
            defaultValue = "weather_raw")
    String rawCollection;

    @ConfigProperty(
            name = "weather.mongo.enriched-collection",
            defaultValue = "weather_enriched")
    String enrichedCollection;

    /**
     * Stores a raw fetch and its enriched observations.
     *
     * @param raw
     *            full API payload with request context
     * @param observations
     *            enriched hourly observations
     * @return number of enriched documents written
     */
    public int saveBatch(RawFetchDocument raw, List<WeatherObservationType> observations) {
        try {
            collection(rawCollection).insertOne(toDocument(raw));

            if (observations.isEmpty()) {
                LOG.warnf("Fetch for %s returned no hourly observations", raw.city());
                return 0;
            }

            List<Document> documents = new ArrayList<>(observations.size());
            for (WeatherObservationType observation : observations) {
                documents.add(toDocument(observation));
            }
            collection(enrichedCollection).insertMany(documents);
            LOG.debugf("Stored %d enriched observations in %s.%s", documents.size(), databaseName,
                    enrichedCollection);
            return documents.size();
        } catch (MongoException e) {
            throw new IllegalStateException("Failed to store weather batch: " + e.getMessage(), e);
        }
    }

    /**
     * Reads every enriched observation. Documents that no longer match the observation shape are skipped.
     *
     * @return enriched observations in insertion order
     */
    public List<WeatherObservationType> findEnriched() {
        List<WeatherObservationType> observations = new ArrayList<>();
        int skipped = 0;
        try (MongoCursor<Document> cursor = collection(enrichedCollection).find().iterator()) {
            while (cursor.hasNext()) {
                Document document = cursor.next();
                document.remove("_id");
                try {
                    observations.add(objectMapper.readValue(document.toJson(), WeatherObservationType.class));
                } catch (JsonProcessingException e) {
                    skipped++;
                    LOG.debugf("Skipping unreadable observation document: %s", e.getOriginalMessage());
                }
            }
        } catch (MongoException e) {
            throw new IllegalStateException("Failed to read enriched observations: " + e.getMessage(), e);
        }
        if (skipped > 0) {
            LOG.warnf("Skipped %d unreadable observation documents in %s.%s", skipped, databaseName,
                    enrichedCollection);
        }
        return observations;
    }

    private MongoCollection<Document> collection(String name) {
        return mongoClient.getDatabase(databaseName).getCollection(name);
    }

    private Document toDocument(Object value) {
        try {
            return Document.parse(objectMapper.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
