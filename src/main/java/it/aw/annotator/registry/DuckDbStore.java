package it.aw.annotator.registry;

import it.aw.annotator.exception.StoreException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Connessione DuckDB condivisa da tutti i registry.
 * <p>
 * DuckDBConnection non è thread-safe: ogni accesso passa da {@link #execute},
 * sincronizzato su questa istanza. Lo schema viene creato all'avvio se manca.
 * Non ci sono foreign key: la cancellazione a cascata è a carico dei registry.
 */
@Component
public class DuckDbStore {

    private static final Logger log = LoggerFactory.getLogger(DuckDbStore.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS documents (
                id             VARCHAR   PRIMARY KEY,
                filename       VARCHAR   NOT NULL,
                full_text      VARCHAR   NOT NULL,
                user_intent    VARCHAR,
                summary        VARCHAR,
                main_arguments VARCHAR,
                key_concepts   VARCHAR,
                chunk_count    INTEGER   NOT NULL DEFAULT 0,
                uploaded_at    TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS chunks (
                id             VARCHAR   PRIMARY KEY,
                document_id    VARCHAR   NOT NULL,
                chunk_index    INTEGER   NOT NULL,
                text           VARCHAR   NOT NULL,
                start_position INTEGER   NOT NULL,
                end_position   INTEGER   NOT NULL,
                embedding      VARCHAR
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS annotations (
                id                 VARCHAR   PRIMARY KEY,
                document_id        VARCHAR   NOT NULL,
                start_position     INTEGER   NOT NULL,
                end_position       INTEGER   NOT NULL,
                highlighted_text   VARCHAR   NOT NULL,
                category           VARCHAR   NOT NULL,
                note               VARCHAR   NOT NULL,
                searchable_content VARCHAR,
                ai_generated       BOOLEAN   NOT NULL,
                confidence_score   DOUBLE,
                created_at         TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS projects (
                id              VARCHAR   PRIMARY KEY,
                name            VARCHAR   NOT NULL,
                thesis          VARCHAR,
                context_summary VARCHAR,
                created_at      TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS folders (
                id              VARCHAR PRIMARY KEY,
                project_id      VARCHAR NOT NULL,
                name            VARCHAR NOT NULL,
                description     VARCHAR,
                context_summary VARCHAR
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS project_documents (
                id                VARCHAR PRIMARY KEY,
                project_id        VARCHAR NOT NULL,
                document_id       VARCHAR NOT NULL,
                folder_id         VARCHAR,
                retrieval_context VARCHAR
            )
            """
    );

    /** Operazione JDBC eseguita con la connessione condivisa. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    private final String dbPath;
    private Connection conn;

    public DuckDbStore(@Value("${store.db.path}") String dbPath) {
        this.dbPath = dbPath;
    }

    @PostConstruct
    public void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
        }
        log.info("DuckDbStore: schema pronto su {}", path.toAbsolutePath());
    }

    @PreDestroy
    public void close() {
        try {
            if (conn != null && !conn.isClosed()) {
                try (Statement stmt = conn.createStatement()) {
                    stmt.execute("CHECKPOINT");
                }
                conn.close();
            }
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB: {}", e.getMessage());
        }
    }

    /**
     * Esegue il lavoro in modo esclusivo, convertendo le {@link SQLException}.
     *
     * @param what descrizione dell'operazione, usata nel messaggio d'errore
     */
    public synchronized <T> T execute(String what, SqlWork<T> work) {
        try {
            return work.run(conn);
        } catch (SQLException e) {
            throw new StoreException("Errore " + what, e);
        }
    }

    /**
     * Come {@link #execute} ma in un'unica transazione: rollback se il lavoro fallisce.
     */
    public synchronized <T> T inTransaction(String what, SqlWork<T> work) {
        try {
            conn.setAutoCommit(false);
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Errore " + what, e);
        }
    }
}
