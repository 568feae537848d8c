package com.example.realestate.loader;

import com.example.realestate.adapter.SourceLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class DatabaseLoader {

    private static final Logger log = LoggerFactory.getLogger(DatabaseLoader.class);

    public static final String DEFAULT_QUERY = "SELECT longitude, latitude, unit_price, year_month, "
            + "area, address, building_type, total_price "
            + "FROM real_estate_transactions "
            + "ORDER BY year_month";

    private final JdbcTemplate jdbcTemplate;

    public DatabaseLoader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Executa a consulta e materializa todas as linhas do resultado.
     *
     * @param sql Consulta SQL; as colunas devem usar os nomes padronizados (snake_case).
     * @return As linhas, uma por mapa coluna-valor.
     * @throws SourceLoadException Se a consulta falhar.
     */
    public List<Map<String, Object>> load(String sql) {
        log.info("Carregando transações do banco de dados...");
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql);
            log.info("Carregadas {} linhas do banco de dados.", rows.size());
            return rows;
        } catch (DataAccessException e) {
            log.error("Erro ao consultar o banco de dados: {}", e.getMessage(), e);
            throw new SourceLoadException("Falha ao consultar o banco de dados: " + e.getMessage(), e);
        }
    }
}
