package com.memberhub.search.retrieval.lexical;

import com.memberhub.search.index.ContentKey;
import com.memberhub.search.index.ContentType;
import com.memberhub.search.index.LexicalFields;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.en.EnglishAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.QueryBuilder;
import org.springframework.stereotype.Component;

@Component
public class LexicalIndex {
    private static final String KEY_FIELD = "key";
    private static final String TYPE_FIELD = "content_type";
    private static final String ID_FIELD = "content_id";
    private static final Set<String> STORED_FIELDS = Set.of(TYPE_FIELD, ID_FIELD);

    private final LexicalSearchProperties properties;
    private final Analyzer analyzer = new EnglishAnalyzer();
    private final Directory directory = new ByteBuffersDirectory();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    public LexicalIndex(LexicalSearchProperties properties) {
        this.properties = properties;
        BM25Similarity similarity = new BM25Similarity((float) properties.getK1(), (float) properties.getB());
        try {
            IndexWriterConfig config = new IndexWriterConfig(analyzer);
            config.setOpenMode(IndexWriterConfig.OpenMode.CREATE);
            config.setSimilarity(similarity);
            this.writer = new IndexWriter(directory, config);
            this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
                @Override
                public IndexSearcher newSearcher(IndexReader reader, IndexReader previousReader) {
                    IndexSearcher searcher = new IndexSearcher(reader);
                    searcher.setSimilarity(similarity);
                    return searcher;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("failed to open lexical index", e);
        }
    }

    public void index(ContentKey key, LexicalFields fields) {
        write(key, fields);
        refresh();
    }

    public void stage(ContentKey key, LexicalFields fields) {
        write(key, fields);
    }

    public void refresh() {
        try {
            searcherManager.maybeRefreshBlocking();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to refresh lexical index", e);
        }
    }

    public void remove(ContentKey key) {
        try {
            writer.deleteDocuments(keyTerm(key));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to remove " + key + " from lexical index", e);
        }
        refresh();
    }

    public boolean contains(ContentKey key) {
        return withSearcher(searcher -> searcher.count(new TermQuery(keyTerm(key))) > 0);
    }

    public int documentCount() {
        return withSearcher(searcher -> searcher.getIndexReader().numDocs());
    }

    public Map<ContentKey, Double> search(String queryText) {
        Query query = buildQuery(queryText);
        if (query == null) {
            return Map.of();
        }
        return withSearcher(searcher -> {
            int size = Math.max(1, searcher.getIndexReader().numDocs());
            TopDocs top = searcher.search(query, size);
            StoredFields stored = searcher.storedFields();
            Map<ContentKey, Double> scores = new LinkedHashMap<>();
            for (ScoreDoc scoreDoc : top.scoreDocs) {
                Document document = stored.document(scoreDoc.doc, STORED_FIELDS);
                ContentType type = ContentType.fromTag(document.get(TYPE_FIELD));
                if (type != null) {
                    scores.put(ContentKey.of(type, document.get(ID_FIELD)), (double) scoreDoc.score);
                }
            }
            return scores;
        });
    }

    @PreDestroy
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private Query buildQuery(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return null;
        }
        QueryBuilder builder = new QueryBuilder(analyzer);
        BooleanQuery.Builder combined = new BooleanQuery.Builder();
        int clauses = 0;
        for (LexicalField field : LexicalField.values()) {
            double weight = properties.weightOf(field);
            if (weight <= 0.0) {
                continue;
            }
            Query fieldQuery = builder.createBooleanQuery(field.getPropertyName(), queryText);
            if (fieldQuery == null) {
                continue;
            }
            combined.add(new BoostQuery(fieldQuery, (float) weight), BooleanClause.Occur.SHOULD);
            clauses++;
        }
        return clauses == 0 ? null : combined.build();
    }

    private void write(ContentKey key, LexicalFields fields) {
        Document document = new Document();
        document.add(new StringField(KEY_FIELD, key.toString(), Field.Store.NO));
        document.add(new StoredField(TYPE_FIELD, key.contentType().getTag()));
        document.add(new StoredField(ID_FIELD, key.contentId()));
        addText(document, LexicalField.TITLE, fields.getTitle());
        addText(document, LexicalField.DESCRIPTION, fields.getDescription());
        addText(document, LexicalField.BODY, fields.getBody());
        for (String tag : fields.getTags()) {
            addText(document, LexicalField.TAGS, tag);
        }
        try {
            writer.updateDocument(keyTerm(key), document);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to index " + key, e);
        }
    }

    private static void addText(Document document, LexicalField field, String value) {
        if (value != null && !value.isBlank()) {
            document.add(new TextField(field.getPropertyName(), value, Field.Store.NO));
        }
    }

    private static Term keyTerm(ContentKey key) {
        return new Term(KEY_FIELD, key.toString());
    }

    private <T> T withSearcher(SearcherCallback<T> callback) {
        try {
            IndexSearcher searcher = searcherManager.acquire();
            try {
                return callback.apply(searcher);
            } finally {
                searcherManager.release(searcher);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("lexical index read failed", e);
        }
    }

    @FunctionalInterface
    private interface SearcherCallback<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }
}
