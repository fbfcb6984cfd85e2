package io.coko.billing.batch.reader;

import io.coko.billing.batch.model.DueSubscriptionRow;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.NonNull;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.UUID;

public class DueSubscriptionRowMapper implements RowMapper<DueSubscriptionRow> {

  @Override
  public DueSubscriptionRow mapRow(@NonNull ResultSet rs, int rowNum) throws SQLException {
    DueSubscriptionRow row = new DueSubscriptionRow();
    row.setSubscriptionId(rs.getObject("id", UUID.class));
    row.setUserRef(rs.getString("user_ref"));
    row.setStatus(rs.getString("status"));
    row.setVersion(rs.getLong("version"));
    return row;
  }
}
