package com.aska.ghostpilot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 应用名 → 包名
 *
 * 模型给出的是应用的显示名（"微信"、"wechat"），启动时需要包名。
 */
public final class AppPackages {

    private static final Pattern PACKAGE_NAME =
        Pattern.compile("^[a-zA-Z][a-zA-Z0-9_]*(\\.[a-zA-Z][a-zA-Z0-9_]*)+$");

    private static final Map<String, String> PACKAGES;

    static {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("微信", "com.tencent.mm");
        m.put("wechat", "com.tencent.mm");
        m.put("支付宝", "com.eg.android.AlipayGphone");
        m.put("alipay", "com.eg.android.AlipayGphone");
        m.put("淘宝", "com.taobao.taobao");
        m.put("taobao", "com.taobao.taobao");
        m.put("抖音", "com.ss.android.ugc.aweme");
        m.put("tiktok", "com.ss.android.ugc.aweme");
        m.put("bilibili", "tv.danmaku.bili");
        m.put("b站", "tv.danmaku.bili");
        m.put("哔哩哔哩", "tv.danmaku.bili");
        m.put("高德地图", "com.autonavi.minimap");
        m.put("amap", "com.autonavi.minimap");
        m.put("百度地图", "com.baidu.BaiduMap");
        m.put("美团", "com.sankuai.meituan");
        m.put("meituan", "com.sankuai.meituan");
        m.put("饿了么", "me.ele");
        m.put("eleme", "me.ele");
        m.put("京东", "com.jingdong.app.mall");
        m.put("jd", "com.jingdong.app.mall");
        m.put("拼多多", "com.xunmeng.pinduoduo");
        m.put("pinduoduo", "com.xunmeng.pinduoduo");
        m.put("网易云音乐", "com.netease.cloudmusic");
        m.put("qq音乐", "com.tencent.qqmusic");
        m.put("qq", "com.tencent.mobileqq");
        m.put("小红书", "com.xingin.xhs");
        m.put("xiaohongshu", "com.xingin.xhs");
        m.put("设置", "com.android.settings");
        m.put("settings", "com.android.settings");
        m.put("相机", "com.android.camera");
        m.put("camera", "com.android.camera");
        m.put("浏览器", "com.android.browser");
        m.put("browser", "com.android.browser");
        m.put("chrome", "com.android.chrome");
        PACKAGES = Collections.unmodifiableMap(m);
    }

    private AppPackages() {}

    /**
     * 解析应用名，不区分大小写；已经是包名时原样返回；找不到返回 null
     */
    public static String resolve(String appName) {
        if (appName == null) return null;
        String name = appName.trim();
        if (name.isEmpty()) return null;

        String pkg = PACKAGES.get(name.toLowerCase());
        if (pkg != null) return pkg;

        return PACKAGE_NAME.matcher(name).matches() ? name : null;
    }
}
