package com.lhcz.txn2db.config;

/**
 * 解析后的数据库连接参数
 */
public record JdbcTarget(String url, String user, String password) {

    @Override
    public String toString() {
        // 不输出密码
        return "JdbcTarget[url=" + url + ", user=" + user + "]";
    }
}
