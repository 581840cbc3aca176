package com.di.creatormatch.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL queries loaded from sql-queries.yml (creatormatch.sql.*).
 * No SQL is hardcoded in JDBC store classes; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "creatormatch.sql")
public class SqlQueriesProperties {

    private Creators creators = new Creators();

    public Creators getCreators() { return creators; }
    public void setCreators(Creators creators) { this.creators = creators; }

    public static class Creators {
        private String findByNiche;
        private String findByKeyword;
        private String findFallback;
        private String findById;
        private String insert;
        private String update;
        public String getFindByNiche() { return findByNiche; }
        public void setFindByNiche(String findByNiche) { this.findByNiche = findByNiche; }
        public String getFindByKeyword() { return findByKeyword; }
        public void setFindByKeyword(String findByKeyword) { this.findByKeyword = findByKeyword; }
        public String getFindFallback() { return findFallback; }
        public void setFindFallback(String findFallback) { this.findFallback = findFallback; }
        public String getFindById() { return findById; }
        public void setFindById(String findById) { this.findById = findById; }
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
    }
}
