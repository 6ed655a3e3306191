package tberg.kopls.model;

import tberg.kopls.InputValidationException;

public enum ModelType {

	REGRESSION("reg"),
	DISCRIMINANT("da");

	private final String tag;

	private ModelType(String tag) {
		this.tag = tag;
	}

	public String tag() {
		return tag;
	}

	public static ModelType fromTag(String tag) {
		if (tag != null) {
			String t = tag.trim().toLowerCase();
			if (t.equals("reg") || t.equals("regression")) return REGRESSION;
			if (t.equals("da") || t.equals("discriminant")) return DISCRIMINANT;
		}
		throw new InputValidationException("modelType must be `reg` or `da`, got `"+tag+"`");
	}

}
