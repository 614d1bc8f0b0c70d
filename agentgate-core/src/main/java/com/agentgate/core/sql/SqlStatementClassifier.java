package com.agentgate.core.sql;

import com.agentgate.api.security.AccessType;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;

import java.time.Duration;

/**
 * SQL 语句分类：判定一条语句需要的访问类型
 * <p>
 * 只缓存“语句 -> 访问类型”的解析结果，从不缓存鉴权结论。
 * </p>
 */
@Slf4j
public class SqlStatementClassifier {

    private static final int DEFAULT_CACHE_SIZE = 1000;
    private static final Duration DEFAULT_EXPIRE = Duration.ofMinutes(10);

    private final Cache<String, AccessType> parseCache;

    public SqlStatementClassifier() {
        this(DEFAULT_CACHE_SIZE, DEFAULT_EXPIRE);
    }

    public SqlStatementClassifier(long maximumSize, Duration expireAfterWrite) {
        this.parseCache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    /**
     * @param sql SQL 语句
     * @return SELECT 为 READ，INSERT/UPDATE/DELETE 为 WRITE，其余或无法解析为 EXECUTE
     */
    public AccessType classify(String sql) {
        if (sql == null || sql.isBlank()) {
            return AccessType.EXECUTE;
        }
        String key = sql.trim();
        return parseCache.get(key, this::parse);
    }

    private AccessType parse(String sql) {
        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            if (statement instanceof Select) {
                return AccessType.READ;
            } else if (statement instanceof Insert || statement instanceof Update || statement instanceof Delete) {
                return AccessType.WRITE;
            }
            return AccessType.EXECUTE;
        } catch (JSQLParserException e) {
            // 无法解析（可能是畸形 SQL），按最高权限要求处理
            log.error("[SQL Parse Error] Treating ambiguous SQL as EXECUTE: {}", sql);
            return AccessType.EXECUTE;
        }
    }

    public long cachedEntries() {
        return parseCache.estimatedSize();
    }
}
