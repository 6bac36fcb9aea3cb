package io.github.mocanjie.base.mytenant.utils;

import org.springframework.util.StringUtils;

public class CommonUtils {

	public static String camelCaseToUnderscore(String str){
		if(!StringUtils.hasText(str)) return str;
		StringBuilder sb = new StringBuilder(str.length() + 4);
		for(int i = 0;i<str.length();i++){
			char c = str.charAt(i);
			if(Character.isUpperCase(c)){
				if(i > 0) sb.append('_');
				sb.append(Character.toLowerCase(c));
				continue;
			}
			sb.append(c);
		}
		return sb.toString();
	}

	/**
	 * 表引用：有别名用别名，否则用表名
	 */
	public static String tableRef(String tableName, String alias){
		return StringUtils.hasText(alias) ? alias : tableName;
	}

}
