package com.fedquery.adapter;

import com.fedquery.exception.SourceConnectionException;
import com.fedquery.meta.DataSourceConfig;
import com.fedquery.query.Field;
import com.fedquery.query.FieldValue;
import com.fedquery.query.ParsedQuery.ComparisonOperator;
import com.fedquery.query.ParsedQuery.Direction;
import com.fedquery.query.Row;
import org.apache.calcite.sql.type.SqlTypeFamily;
import org.apache.calcite.sql.type.SqlTypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JDBC 数据源适配器
 * 表和视图作为集合；每次调用打开一个连接，过滤、排序与截断下推为参数化 SQL
 * <p>
 * 数据库以大写存储未加引号的标识符时（如 H2），全大写的表名、列名以小写对外暴露
 */
public class JdbcSourceAdapter implements SourceAdapter {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSourceAdapter.class);
    // H2 2.x 报告普通表为 BASE TABLE
    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE", "VIEW"};

    private DataSourceConfig config;
    private String jdbcUrl;
    private int timeoutSeconds;
    private volatile boolean connected;

    // 对外名称 → 数据库中的实际表名
    private volatile Map<String, String> tableNames = Map.of();

    @Override
    public boolean connect(DataSourceConfig config, Duration timeout) throws SourceConnectionException {
        this.config = config;
        this.timeoutSeconds = (int) Math.max(1, timeout.getSeconds());
        try {
            this.jdbcUrl = config.buildJdbcUrl();
            loadDriver(config);
        } catch (IllegalArgumentException | ClassNotFoundException e) {
            throw new SourceConnectionException(config.getId(),
                "Invalid JDBC configuration for data source '" + config.getId() + "': " + e.getMessage(), e);
        }

        try (Connection connection = openConnection()) {
            if (!connection.isValid(timeoutSeconds)) {
                logger.warn("Connection to data source {} is not valid", config.getId());
                connected = false;
                return false;
            }
            DatabaseMetaData metaData = connection.getMetaData();
            logger.info("Connected to data source {} ({} {})", config.getId(),
                metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion());
            tableNames = loadTableNames(connection);
            connected = true;
            return true;
        } catch (SQLException e) {
            connected = false;
            throw new SourceConnectionException(config.getId(),
                "Connection to data source '" + config.getId() + "' failed: " + e.getMessage(), e);
        }
    }

    /**
     * 加载 JDBC 驱动；config.driver 优先，其次按类型推断
     */
    private void loadDriver(DataSourceConfig config) throws ClassNotFoundException {
        String driver = config.getConfigString("driver");
        if (driver != null && !driver.isEmpty()) {
            Class.forName(driver);
            return;
        }
        switch (config.getType() != null ? config.getType().toLowerCase(Locale.ROOT) : "") {
            case "postgresql":
            case "postgres":
                Class.forName("org.postgresql.Driver");
                break;
            case "mysql":
                Class.forName("com.mysql.cj.jdbc.Driver");
                break;
            case "h2":
                Class.forName("org.h2.Driver");
                break;
            default:
                // 通用 jdbc 类型依赖 DriverManager 的 ServiceLoader 自动注册
                break;
        }
    }

    private Connection openConnection() throws SQLException {
        DriverManager.setLoginTimeout(timeoutSeconds);
        String username = config.getConfigString("username");
        String password = config.getConfigString("password");
        return DriverManager.getConnection(jdbcUrl, username != null ? username : "", password != null ? password : "");
    }

    private Map<String, String> loadTableNames(Connection connection) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        String schema = config.getConfigString("schema");
        Map<String, String> names = new LinkedHashMap<>();
        try (ResultSet rs = metaData.getTables(connection.getCatalog(), schema, "%", TABLE_TYPES)) {
            while (rs.next()) {
                String tableName = rs.getString("TABLE_NAME");
                names.put(externalName(metaData, tableName), tableName);
            }
        }
        return names;
    }

    private static String externalName(DatabaseMetaData metaData, String name) throws SQLException {
        if (metaData.storesUpperCaseIdentifiers() && name.equals(name.toUpperCase(Locale.ROOT))) {
            return name.toLowerCase(Locale.ROOT);
        }
        return name;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public List<String> listCollections() throws SourceConnectionException {
        requireConnected();
        try (Connection connection = openConnection()) {
            tableNames = loadTableNames(connection);
            return new ArrayList<>(tableNames.keySet());
        } catch (SQLException e) {
            throw new SourceConnectionException(config.getId(),
                "Listing collections of data source '" + config.getId() + "' failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Field> getCollectionSchema(String collection) throws SourceConnectionException {
        requireConnected();
        String table = tableNames.get(collection);
        if (table == null) {
            return List.of();
        }
        List<Field> fields = new ArrayList<>();
        try (Connection connection = openConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getColumns(connection.getCatalog(), config.getConfigString("schema"), table, "%")) {
                while (rs.next()) {
                    String column = rs.getString("COLUMN_NAME");
                    int jdbcType = rs.getInt("DATA_TYPE");
                    fields.add(new Field(externalName(metaData, column), documentType(jdbcType), rs.getString("TYPE_NAME")));
                }
            }
        } catch (SQLException e) {
            throw new SourceConnectionException(config.getId(),
                "Reading schema of " + config.getId() + "/" + collection + " failed: " + e.getMessage(), e);
        }
        return fields;
    }

    /**
     * java.sql.Types → 文档类型名，借助 Calcite 的类型族划分
     */
    static String documentType(int jdbcType) {
        SqlTypeName typeName = SqlTypeName.getNameForJdbcType(jdbcType);
        SqlTypeFamily family = typeName != null ? typeName.getFamily() : null;
        if (family == null) {
            return "object";
        }
        switch (family) {
            case CHARACTER:
            case BINARY:
                return "string";
            case NUMERIC:
                return "number";
            case BOOLEAN:
                return "boolean";
            case DATE:
            case TIME:
            case TIMESTAMP:
                return "date";
            case ARRAY:
            case MULTISET:
                return "array";
            default:
                return "object";
        }
    }

    @Override
    public List<Row> executeQuery(String collection, FilterSpec filterSpec) throws SourceConnectionException {
        requireConnected();
        String table = tableNames.get(collection);
        if (table == null) {
            return List.of();
        }
        try (Connection connection = openConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            Map<String, String> columns = columnNames(connection, table);
            List<Object> binds = new ArrayList<>();
            String sql = buildSql(metaData, table, columns, filterSpec, binds);
            logger.debug("Executing on {}: {} {}", config.getId(), sql, binds);

            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setQueryTimeout(timeoutSeconds);
                if (filterSpec.getLimit() != null) {
                    statement.setMaxRows(filterSpec.getLimit());
                }
                for (int i = 0; i < binds.size(); i++) {
                    statement.setObject(i + 1, binds.get(i));
                }
                try (ResultSet rs = statement.executeQuery()) {
                    return readRows(metaData, rs);
                }
            }
        } catch (SQLException e) {
            throw new SourceConnectionException(config.getId(),
                "Query on " + config.getId() + "/" + collection + " failed: " + e.getMessage(), e);
        }
    }

    private Map<String, String> columnNames(Connection connection, String table) throws SQLException {
        DatabaseMetaData metaData = connection.getMetaData();
        Map<String, String> columns = new LinkedHashMap<>();
        try (ResultSet rs = metaData.getColumns(connection.getCatalog(), config.getConfigString("schema"), table, "%")) {
            while (rs.next()) {
                String column = rs.getString("COLUMN_NAME");
                columns.put(externalName(metaData, column), column);
            }
        }
        return columns;
    }

    String buildSql(DatabaseMetaData metaData, String table, Map<String, String> columns, FilterSpec filterSpec,
                    List<Object> binds) throws SQLException, SourceConnectionException {
        String quote = metaData.getIdentifierQuoteString();
        quote = quote == null || quote.trim().isEmpty() ? "" : quote.trim();

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quote(quote, table));
        List<String> predicates = new ArrayList<>();
        for (FilterSpec.Filter filter : filterSpec.getFilters()) {
            String column = quote(quote, requireColumn(columns, filter.getField()));
            FieldValue value = filter.getValue();
            if (value.isNull()) {
                if (filter.getOperator() == ComparisonOperator.EQ) {
                    predicates.add(column + " IS NULL");
                } else if (filter.getOperator() == ComparisonOperator.NE) {
                    predicates.add(column + " IS NOT NULL");
                } else {
                    predicates.add("1 = 0");
                }
                continue;
            }
            predicates.add(column + " " + filter.getOperator().getSymbol() + " ?");
            binds.add(bindValue(value));
        }
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        if (!filterSpec.getOrderBy().isEmpty()) {
            List<String> keys = new ArrayList<>();
            for (FilterSpec.Sort sort : filterSpec.getOrderBy()) {
                String column = quote(quote, requireColumn(columns, sort.getField()));
                // NULL 在升序中排在最前，降序中排在最后
                keys.add(sort.getDirection() == Direction.DESC
                    ? "CASE WHEN " + column + " IS NULL THEN 1 ELSE 0 END, " + column + " DESC"
                    : "CASE WHEN " + column + " IS NULL THEN 0 ELSE 1 END, " + column + " ASC");
            }
            sql.append(" ORDER BY ").append(String.join(", ", keys));
        }
        return sql.toString();
    }

    private String requireColumn(Map<String, String> columns, String field) throws SourceConnectionException {
        String column = columns.get(field);
        if (column == null) {
            throw new SourceConnectionException(config.getId(), "Unknown column '" + field + "'");
        }
        return column;
    }

    private static String quote(String quote, String identifier) {
        if (quote.isEmpty()) {
            return identifier;
        }
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    private static Object bindValue(FieldValue value) {
        if (value.getKind() == FieldValue.Kind.DATE) {
            return Timestamp.from(value.asDate());
        }
        return value.toJava();
    }

    private static List<Row> readRows(DatabaseMetaData metaData, ResultSet rs) throws SQLException {
        ResultSetMetaData rsMeta = rs.getMetaData();
        int columnCount = rsMeta.getColumnCount();
        String[] names = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            names[i - 1] = externalName(metaData, rsMeta.getColumnLabel(i));
        }
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Row.Builder row = Row.builder();
            for (int i = 1; i <= columnCount; i++) {
                Object value = rs.getObject(i);
                if (value instanceof Clob) {
                    value = rs.getString(i);
                }
                row.put(names[i - 1], value);
            }
            rows.add(row.build());
        }
        return rows;
    }

    @Override
    public void disconnect() {
        connected = false;
        tableNames = Map.of();
    }

    private void requireConnected() throws SourceConnectionException {
        if (!connected) {
            String id = config != null ? config.getId() : null;
            throw new SourceConnectionException(id, "Data source '" + id + "' is not connected");
        }
    }
}
