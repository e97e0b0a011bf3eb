package dev.wh40kmeta.scraper.persistence;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Scrape log stored in the {@code scrape_logs} table over JDBC */
public class JdbcScrapeLogRepository implements ScrapeLogRepository {
	private static final Logger logger = LoggerFactory.getLogger(JdbcScrapeLogRepository.class);

	static final String INSERT = "INSERT INTO scrape_logs "
			+ "(source, scrape_type, status, started_at, completed_at, items_processed, items_failed, error_message) "
			+ "VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id";
	static final String DELETE = "DELETE FROM scrape_logs WHERE id = ?";

	private final String url;
	private final String user;
	private final String password;

	public JdbcScrapeLogRepository(String url, String user, String password) {
		this.url = url;
		this.user = user;
		this.password = password;
	}

	private Connection connect() throws SQLException {
		return user != null ? DriverManager.getConnection(url, user, password) : DriverManager.getConnection(url);
	}

	@Override
	public long write(ScrapeLogEntry entry) {
		try (Connection connection = connect();
				PreparedStatement statement = connection.prepareStatement(INSERT)) {
			statement.setString(1, entry.source());
			statement.setString(2, entry.scrapeType());
			statement.setString(3, entry.status());
			statement.setTimestamp(4, Timestamp.from(entry.startedAt()));
			if (entry.completedAt() != null) {
				statement.setTimestamp(5, Timestamp.from(entry.completedAt()));
			} else {
				statement.setNull(5, Types.TIMESTAMP);
			}
			statement.setInt(6, entry.itemsProcessed());
			statement.setInt(7, entry.itemsFailed());
			statement.setString(8, entry.errorMessage());
			try (ResultSet rs = statement.executeQuery()) {
				rs.next();
				long id = rs.getLong(1);
				logger.debug("Wrote scrape log {} ({} {})", id, entry.scrapeType(), entry.status());
				return id;
			}
		} catch (SQLException e) {
			throw new ScrapeLogException("Failed to write scrape log: " + e.getMessage(), e);
		}
	}

	@Override
	public boolean verifyWritable() {
		try {
			long id = write(ScrapeLogEntry.connectionTest());
			try (Connection connection = connect();
					PreparedStatement statement = connection.prepareStatement(DELETE)) {
				statement.setLong(1, id);
				statement.executeUpdate();
			}
			logger.info("Database write test successful (test row {})", id);
			return true;
		} catch (SQLException | ScrapeLogException e) {
			logger.error("Database write test failed: {}", e.getMessage());
			return false;
		}
	}

	@Override
	public String toString() {
		return url;
	}
}
