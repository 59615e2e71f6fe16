package com.aska.ghostpilot;

/**
 * 执行 shell 命令所需的权限检查
 *
 * 权限的申请由宿主负责，这里只读取结果。
 */
public interface Authorizer {

    /**
     * 不做检查，用于已经具备 shell 权限的环境（adb、root）
     */
    Authorizer ALWAYS = () -> true;

    boolean hasPermission();
}
