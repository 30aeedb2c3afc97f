package com.slb.live_backend.modules.reward.handler;

import com.slb.live_backend.modules.reward.enums.RewardRuleType;
import org.apache.ibatis.type.BaseTypeHandler;
import org.apache.ibatis.type.JdbcType;
import org.apache.ibatis.type.MappedTypes;

import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * rule_type 列与 {@link RewardRuleType} 的互转，库里存 code（如 sign-watch）。
 */
@MappedTypes(RewardRuleType.class)
public class RewardRuleTypeHandler extends BaseTypeHandler<RewardRuleType> {

    @Override
    public void setNonNullParameter(PreparedStatement ps, int i, RewardRuleType parameter, JdbcType jdbcType)
            throws SQLException {
        ps.setString(i, parameter.getCode());
    }

    @Override
    public RewardRuleType getNullableResult(ResultSet rs, String columnName) throws SQLException {
        return decode(rs.getString(columnName));
    }

    @Override
    public RewardRuleType getNullableResult(ResultSet rs, int columnIndex) throws SQLException {
        return decode(rs.getString(columnIndex));
    }

    @Override
    public RewardRuleType getNullableResult(CallableStatement cs, int columnIndex) throws SQLException {
        return decode(cs.getString(columnIndex));
    }

    static RewardRuleType decode(String value) throws SQLException {
        if (value == null) {
            return null;
        }
        return RewardRuleType.fromCode(value)
                .orElseThrow(() -> new SQLException("Unknown reward rule type: " + value));
    }
}
