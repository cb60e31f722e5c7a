package my.adsoptimizer.app.domain;

public enum CreativeBucket {
	BEST,
	WORST,
	UNKNOWN
}
